package com.bank_sync_engine.openbanking;

import com.bank_sync_engine.vault.TokenSet;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Consent, authorization-code exchange and refresh against one bank's authorization server.
 * Production and sandbox implementations share this contract; {@code open-banking.mode} picks one.
 * <p>
 * Implementations translate every transport or provider failure into the
 * {@link com.bank_sync_engine.exception.BankSyncException} taxonomy.
 */
public interface OAuth2Connector {

    /**
     * Builds the authorization URL the user is sent to, with a fresh {@code state} and {@code nonce}.
     * Fails with {@code ProviderNotFoundException} for an unknown or inactive provider.
     */
    Mono<ConsentGrant> initiateConsent(String providerCode, List<String> permissions);

    /**
     * Exchanges an authorization code for tokens. A malformed, expired or reused code fails with
     * {@code InvalidGrantException}.
     */
    Mono<TokenSet> exchangeCode(String authorizationCode, String providerCode);

    /**
     * Plain refresh-token grant. Callers must serialize refreshes per connection, see
     * {@code TokenRefreshCoordinator}.
     */
    Mono<TokenSet> refreshToken(String refreshToken, String providerCode);
}
