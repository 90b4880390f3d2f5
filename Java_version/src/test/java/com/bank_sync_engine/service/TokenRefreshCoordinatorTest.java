package com.bank_sync_engine.service;

import com.bank_sync_engine.config.SyncProperties;
import com.bank_sync_engine.config.VaultProperties;
import com.bank_sync_engine.exception.AuthException;
import com.bank_sync_engine.exception.InvalidGrantException;
import com.bank_sync_engine.exception.ProviderUnavailableException;
import com.bank_sync_engine.model.BankConnection;
import com.bank_sync_engine.model.ConnectionStatus;
import com.bank_sync_engine.openbanking.OAuth2Connector;
import com.bank_sync_engine.repository.BankConnectionRepository;
import com.bank_sync_engine.vault.CredentialVault;
import com.bank_sync_engine.vault.TokenSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TokenRefreshCoordinator")
class TokenRefreshCoordinatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-15T12:00:00Z"), ZoneOffset.UTC);
    private static final OffsetDateTime NOW = OffsetDateTime.now(CLOCK);

    @Mock
    private BankConnectionRepository connectionRepository;
    @Mock
    private OAuth2Connector connector;

    private CredentialVault vault;
    private TokenRefreshCoordinator coordinator;

    @BeforeEach
    void setUp() {
        VaultProperties vaultProperties = new VaultProperties();
        vaultProperties.setMasterKey(Base64.getEncoder().encodeToString(
                "0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.US_ASCII)));
        vault = new CredentialVault(vaultProperties);
        coordinator = new TokenRefreshCoordinator(connectionRepository, connector, vault, new SyncProperties(), CLOCK);
        lenient().when(connectionRepository.updateTokens(any(), anyString(), anyString(), any(), any()))
                .thenReturn(Mono.just(1));
    }

    private BankConnection connection(OffsetDateTime expiresAt) {
        return vault.storeTokens(BankConnection.builder()
                        .id(UUID.randomUUID())
                        .providerCode("341")
                        .status(ConnectionStatus.ACTIVE)
                        .build(),
                new TokenSet("access-old", "refresh-old", 0, "Bearer", null), expiresAt);
    }

    @Test
    @DisplayName("Should leave a connection alone while its token outlives the skew")
    void shouldNotRefreshFreshToken() {
        BankConnection fresh = connection(NOW.plusHours(1));

        StepVerifier.create(coordinator.ensureFresh(fresh))
                .expectNext(fresh)
                .verifyComplete();
        verifyNoInteractions(connector, connectionRepository);
    }

    @Test
    @DisplayName("Should share one token exchange between concurrent refreshes of a connection")
    void shouldSingleFlightConcurrentRefreshes() {
        // Given
        BankConnection stale = connection(NOW.plusSeconds(30));
        when(connectionRepository.findById(stale.getId())).thenReturn(Mono.just(stale));
        Sinks.One<TokenSet> exchange = Sinks.one();
        when(connector.refreshToken("refresh-old", "341")).thenReturn(exchange.asMono());

        // When
        List<BankConnection> results = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            coordinator.ensureFresh(stale).subscribe(results::add);
        }
        exchange.tryEmitValue(new TokenSet("access-new", "refresh-new", 3600, "Bearer", null));

        // Then
        verify(connector, times(1)).refreshToken(anyString(), anyString());
        verify(connectionRepository, times(1)).updateTokens(eq(stale.getId()), anyString(), anyString(),
                eq(NOW.plusHours(1)), eq(NOW));
        assertThat(results).hasSize(5);
        assertThat(results).allSatisfy(c -> {
            assertThat(vault.accessToken(c)).isEqualTo("access-new");
            assertThat(vault.refreshToken(c)).isEqualTo("refresh-new");
        });
    }

    @Test
    @DisplayName("Should mark the connection expired when the refresh grant is rejected")
    void shouldExpireConnectionOnRejectedRefresh() {
        // Given
        BankConnection stale = connection(NOW.minusMinutes(5));
        when(connectionRepository.findById(stale.getId())).thenReturn(Mono.just(stale));
        when(connector.refreshToken("refresh-old", "341"))
                .thenReturn(Mono.error(new AuthException("invalid_grant")));
        when(connectionRepository.updateStatus(eq(stale.getId()), eq("EXPIRED"), anyString(), eq(NOW)))
                .thenReturn(Mono.just(1));

        // When / Then
        StepVerifier.create(coordinator.refresh(stale))
                .expectError(InvalidGrantException.class)
                .verify();
        verify(connectionRepository).updateStatus(eq(stale.getId()), eq("EXPIRED"), anyString(), eq(NOW));
    }

    @Test
    @DisplayName("Should keep the connection status when the provider is briefly unavailable")
    void shouldNotExpireConnectionOnTransientFailure() {
        // Given
        BankConnection stale = connection(NOW.minusMinutes(5));
        when(connectionRepository.findById(stale.getId())).thenReturn(Mono.just(stale));
        when(connector.refreshToken("refresh-old", "341"))
                .thenReturn(Mono.error(new ProviderUnavailableException("Token endpoint returned 503", null)));

        // When / Then
        StepVerifier.create(coordinator.refresh(stale))
                .expectError(ProviderUnavailableException.class)
                .verify();
        verify(connectionRepository, never()).updateStatus(any(), anyString(), any(), any());
    }

    @Test
    @DisplayName("Should reuse tokens another refresh stored in the meantime")
    void shouldReuseAlreadyRefreshedTokens() {
        BankConnection stale = connection(NOW.plusSeconds(10));
        BankConnection current = vault.storeTokens(stale,
                new TokenSet("access-new", "refresh-new", 3600, "Bearer", null), NOW);
        when(connectionRepository.findById(stale.getId())).thenReturn(Mono.just(current));

        StepVerifier.create(coordinator.refresh(stale))
                .expectNext(current)
                .verifyComplete();
        verifyNoInteractions(connector);
    }
}
