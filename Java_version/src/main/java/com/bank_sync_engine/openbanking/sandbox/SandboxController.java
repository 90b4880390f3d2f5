package com.bank_sync_engine.openbanking.sandbox;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;

/** Stands in for the bank's consent screen: approves immediately and redirects back. */
@RestController
@RequiredArgsConstructor
@RequestMapping("/sandbox")
@ConditionalOnProperty(prefix = "open-banking", name = "mode", havingValue = "sandbox", matchIfMissing = true)
public class SandboxController {

    private final SandboxBank bank;

    @GetMapping("/{provider}/oauth/authorize")
    public Mono<ResponseEntity<Void>> authorize(@PathVariable("provider") String provider,
                                                @RequestParam("redirect_uri") String redirectUri,
                                                @RequestParam("consent_id") String consentId,
                                                @RequestParam("state") String state) {
        return Mono.fromCallable(() -> bank.authorize(provider, consentId))
                .map(code -> {
                    URI location = UriComponentsBuilder.fromUriString(redirectUri)
                            .queryParam("code", code)
                            .queryParam("state", state)
                            .encode()
                            .build()
                            .toUri();
                    return ResponseEntity.status(HttpStatus.FOUND).location(location).<Void>build();
                });
    }
}
