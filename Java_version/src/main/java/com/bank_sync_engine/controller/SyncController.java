package com.bank_sync_engine.controller;

import com.bank_sync_engine.config.SyncProperties;
import com.bank_sync_engine.dto.ApiResponse;
import com.bank_sync_engine.dto.SyncRequest;
import com.bank_sync_engine.dto.SyncRunResponse;
import com.bank_sync_engine.service.sync.SyncOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/connections/{connectionId}")
public class SyncController {

    private final SyncOrchestrator syncOrchestrator;

    private final SyncProperties syncProperties;

    /** Runs a sync now and answers with the finished run. 409 when one is already running. */
    @PostMapping("/sync")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<SyncRunResponse>> syncNow(@PathVariable UUID connectionId,
                                                      @Valid @RequestBody(required = false) SyncRequest request) {
        int daysBack = (request == null || request.daysBack() == null)
                ? syncProperties.getDaysBack()
                : request.daysBack();
        return syncOrchestrator.syncConnection(connectionId, daysBack)
                .map(SyncRunResponse::from)
                .map(ApiResponse::ok);
    }

    @GetMapping("/sync-runs")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<List<SyncRunResponse>>> runs(@PathVariable UUID connectionId) {
        return syncOrchestrator.recentRuns(connectionId)
                .map(SyncRunResponse::from)
                .collectList()
                .map(ApiResponse::ok);
    }
}
