package com.bank_sync_engine.openbanking.sandbox;

import com.bank_sync_engine.openbanking.ConsentGrant;
import com.bank_sync_engine.openbanking.OAuth2Connector;
import com.bank_sync_engine.openbanking.ProviderRegistry;
import com.bank_sync_engine.vault.TokenSet;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "open-banking", name = "mode", havingValue = "sandbox", matchIfMissing = true)
public class SandboxOAuth2Connector implements OAuth2Connector {

    private final ProviderRegistry providerRegistry;
    private final SandboxBank bank;

    @Override
    public Mono<ConsentGrant> initiateConsent(String providerCode, List<String> permissions) {
        return providerRegistry.require(providerCode)
                .map(provider -> bank.createConsent(provider.getCode(), permissions));
    }

    @Override
    public Mono<TokenSet> exchangeCode(String authorizationCode, String providerCode) {
        return providerRegistry.require(providerCode)
                .map(provider -> bank.exchange(authorizationCode, provider.getCode()));
    }

    @Override
    public Mono<TokenSet> refreshToken(String refreshToken, String providerCode) {
        return providerRegistry.require(providerCode)
                .map(provider -> bank.refresh(refreshToken, provider.getCode()));
    }
}
