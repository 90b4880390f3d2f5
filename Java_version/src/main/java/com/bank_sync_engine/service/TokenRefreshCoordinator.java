package com.bank_sync_engine.service;

import com.bank_sync_engine.config.SyncProperties;
import com.bank_sync_engine.exception.AuthException;
import com.bank_sync_engine.exception.InvalidGrantException;
import com.bank_sync_engine.exception.ResourceNotFoundException;
import com.bank_sync_engine.model.BankConnection;
import com.bank_sync_engine.model.ConnectionStatus;
import com.bank_sync_engine.openbanking.OAuth2Connector;
import com.bank_sync_engine.repository.BankConnectionRepository;
import com.bank_sync_engine.vault.CredentialVault;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-flight token refresh per connection. Concurrent callers for the same connection share one
 * in-flight refresh and all observe the same resulting tokens; most providers rotate refresh
 * tokens, so two parallel refreshes would invalidate each other.
 */
@Slf4j
@Service
public class TokenRefreshCoordinator {

    private final Map<UUID, Mono<BankConnection>> inFlight = new ConcurrentHashMap<>();

    private final BankConnectionRepository connectionRepository;
    private final OAuth2Connector connector;
    private final CredentialVault vault;
    private final SyncProperties syncProperties;
    private final Clock clock;

    public TokenRefreshCoordinator(BankConnectionRepository connectionRepository,
                                   OAuth2Connector connector,
                                   CredentialVault vault,
                                   SyncProperties syncProperties,
                                   Clock clock) {
        this.connectionRepository = connectionRepository;
        this.connector = connector;
        this.vault = vault;
        this.syncProperties = syncProperties;
        this.clock = clock;
    }

    /** The connection as is when its token outlives the refresh skew, otherwise a refreshed copy. */
    public Mono<BankConnection> ensureFresh(BankConnection connection) {
        if (!connection.tokenExpiresWithin(OffsetDateTime.now(clock), syncProperties.getTokenRefreshSkew())) {
            return Mono.just(connection);
        }
        return refresh(connection);
    }

    /**
     * Refreshes the tokens of {@code stale}. Joins the refresh already running for the same
     * connection if there is one.
     */
    public Mono<BankConnection> refresh(BankConnection stale) {
        UUID id = stale.getId();
        return Mono.defer(() -> inFlight.computeIfAbsent(id, key ->
                doRefresh(stale)
                        .doFinally(signal -> inFlight.remove(key))
                        .cache()));
    }

    private Mono<BankConnection> doRefresh(BankConnection stale) {
        return connectionRepository.findById(stale.getId())
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Connection", stale.getId())))
                .flatMap(current -> {
                    OffsetDateTime now = OffsetDateTime.now(clock);
                    // a refresh that finished just before this one started already did the work
                    if (!Objects.equals(current.getAccessTokenCiphertext(), stale.getAccessTokenCiphertext())
                            && !current.tokenExpiresWithin(now, syncProperties.getTokenRefreshSkew())) {
                        return Mono.just(current);
                    }
                    return Mono.defer(() -> connector.refreshToken(vault.refreshToken(current), current.getProviderCode()))
                            .flatMap(tokens -> {
                                BankConnection updated = vault.storeTokens(current, tokens, now).toBuilder()
                                        .status(ConnectionStatus.ACTIVE)
                                        .statusMessage(null)
                                        .updatedAt(now)
                                        .build();
                                return connectionRepository.updateTokens(updated.getId(),
                                                updated.getAccessTokenCiphertext(), updated.getRefreshTokenCiphertext(),
                                                updated.getTokenExpiresAt(), now)
                                        .thenReturn(updated);
                            })
                            .doOnNext(updated -> log.info("Refreshed tokens of connection {}, valid until {}",
                                    updated.getId(), updated.getTokenExpiresAt()))
                            // a rejected refresh means the user has to reconnect
                            .onErrorMap(AuthException.class,
                                    e -> new InvalidGrantException("Token refresh rejected: " + e.getMessage(), e))
                            .onErrorResume(InvalidGrantException.class,
                                    e -> markExpired(current, e).then(Mono.<BankConnection>error(e)));
                });
    }

    private Mono<Integer> markExpired(BankConnection connection, Throwable cause) {
        log.error("Token refresh failed for connection {}, marking it expired: {}", connection.getId(), cause.getMessage());
        return connectionRepository.updateStatus(connection.getId(), ConnectionStatus.EXPIRED.name(),
                "Authorization expired, reconnect the account", OffsetDateTime.now(clock));
    }
}
