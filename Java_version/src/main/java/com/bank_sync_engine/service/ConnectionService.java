package com.bank_sync_engine.service;

import com.bank_sync_engine.config.SyncProperties;
import com.bank_sync_engine.dto.CompleteConsentRequest;
import com.bank_sync_engine.dto.ConnectionResponse;
import com.bank_sync_engine.dto.ConsentRequest;
import com.bank_sync_engine.dto.ConsentResponse;
import com.bank_sync_engine.exception.ResourceNotFoundException;
import com.bank_sync_engine.model.BankConnection;
import com.bank_sync_engine.model.ConnectionStatus;
import com.bank_sync_engine.openbanking.OAuth2Connector;
import com.bank_sync_engine.repository.BankConnectionRepository;
import com.bank_sync_engine.vault.CredentialVault;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Connection lifecycle: consent, code exchange into a stored connection, manual refresh and
 * soft-disable.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConnectionService {

    private final OAuth2Connector connector;
    private final ConsentStore consentStore;
    private final BankConnectionRepository connectionRepository;
    private final CredentialVault vault;
    private final TokenRefreshCoordinator tokenRefreshCoordinator;
    private final SyncProperties syncProperties;
    private final Clock clock;

    public Mono<ConsentResponse> initiateConsent(ConsentRequest request) {
        return connector.initiateConsent(request.providerCode(), request.permissions())
                .map(grant -> {
                    consentStore.register(grant.state(), new ConsentStore.PendingConsent(
                            request.companyId(), request.providerCode(), grant.consentId(),
                            clock.instant().plusSeconds(grant.expiresIn())));
                    return ConsentResponse.builder()
                            .consentId(grant.consentId())
                            .authorizationUrl(grant.authorizationUrl())
                            .state(grant.state())
                            .expiresIn(grant.expiresIn())
                            .build();
                });
    }

    /**
     * Redeems the consent state, exchanges the code and stores the connection. Reconnecting the same
     * (company, provider, agency, account) reuses the existing row.
     */
    public Mono<ConnectionResponse> completeConsent(CompleteConsentRequest request) {
        return Mono.defer(() -> {
            AccountNumberValidator.validate(request.agency(), request.accountNumber());
            ConsentStore.PendingConsent consent = consentStore.redeem(request.state());
            String accountNumber = AccountNumberValidator.normalizeAccountNumber(request.accountNumber());
            String agency = request.agency().trim();

            return connector.exchangeCode(request.code(), consent.providerCode())
                    .flatMap(tokens -> {
                        OffsetDateTime now = OffsetDateTime.now(clock);
                        BankConnection fresh = BankConnection.builder()
                                .companyId(consent.companyId())
                                .providerCode(consent.providerCode())
                                .agency(agency)
                                .accountNumber(accountNumber)
                                .accountType(request.accountType() != null ? request.accountType() : "checking")
                                .currency("BRL")
                                .syncFrequencyHours(syncProperties.getSyncFrequencyHours())
                                .createdAt(now)
                                .build();

                        return connectionRepository.findByCompanyIdAndProviderCodeAndAgencyAndAccountNumber(
                                        consent.companyId(), consent.providerCode(), agency, accountNumber)
                                .defaultIfEmpty(fresh)
                                .flatMap(existingOrNew -> connectionRepository.save(
                                        vault.storeTokens(existingOrNew, tokens, now).toBuilder()
                                                .status(ConnectionStatus.ACTIVE)
                                                .statusMessage(null)
                                                .active(true)
                                                .updatedAt(now)
                                                .build()));
                    })
                    .doOnNext(saved -> log.info("Connection {} linked to provider {} for company {}",
                            saved.getId(), saved.getProviderCode(), saved.getCompanyId()));
        }).map(ConnectionResponse::from);
    }

    public Mono<ConnectionResponse> refresh(UUID connectionId) {
        return load(connectionId)
                .flatMap(tokenRefreshCoordinator::refresh)
                .map(ConnectionResponse::from);
    }

    public Mono<ConnectionResponse> disable(UUID connectionId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return load(connectionId)
                .flatMap(connection -> connectionRepository.disable(connectionId, now)
                        .thenReturn(connection.toBuilder().active(false).updatedAt(now).build()))
                .doOnNext(c -> log.info("Connection {} disabled", c.getId()))
                .map(ConnectionResponse::from);
    }

    public Mono<ConnectionResponse> get(UUID connectionId) {
        return load(connectionId).map(ConnectionResponse::from);
    }

    public Flux<ConnectionResponse> listForCompany(UUID companyId) {
        return connectionRepository.findByCompanyIdAndActiveTrue(companyId).map(ConnectionResponse::from);
    }

    private Mono<BankConnection> load(UUID connectionId) {
        return connectionRepository.findById(connectionId)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Connection", connectionId)));
    }
}
