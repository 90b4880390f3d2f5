package com.bank_sync_engine.controller;

import com.bank_sync_engine.dto.*;
import com.bank_sync_engine.service.ConnectionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1")
public class ConnectionController {

    private final ConnectionService connectionService;

    @PostMapping("/connections/consent")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<ConsentResponse>> initiateConsent(@Valid @RequestBody ConsentRequest request) {
        return connectionService.initiateConsent(request)
                .map(ApiResponse::ok);
    }

    // Called with the code and state the bank redirected back with
    @PostMapping("/connections")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ApiResponse<ConnectionResponse>> completeConsent(@Valid @RequestBody CompleteConsentRequest request) {
        return connectionService.completeConsent(request)
                .map(ApiResponse::ok);
    }

    @GetMapping("/connections/{connectionId}")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<ConnectionResponse>> get(@PathVariable UUID connectionId) {
        return connectionService.get(connectionId)
                .map(ApiResponse::ok);
    }

    @GetMapping("/companies/{companyId}/connections")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<List<ConnectionResponse>>> list(@PathVariable UUID companyId) {
        return connectionService.listForCompany(companyId)
                .collectList()
                .map(ApiResponse::ok);
    }

    @PostMapping("/connections/{connectionId}/refresh")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<ConnectionResponse>> refresh(@PathVariable UUID connectionId) {
        return connectionService.refresh(connectionId)
                .map(ApiResponse::ok);
    }

    @DeleteMapping("/connections/{connectionId}")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<ConnectionResponse>> disable(@PathVariable UUID connectionId) {
        return connectionService.disable(connectionId)
                .map(ApiResponse::ok);
    }
}
