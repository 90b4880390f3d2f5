package com.bank_sync_engine.repository;

import com.bank_sync_engine.model.BankConnection;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

public interface BankConnectionRepository extends ReactiveCrudRepository<BankConnection, UUID> {

    Mono<BankConnection> findByCompanyIdAndProviderCodeAndAgencyAndAccountNumber(
            UUID companyId, String providerCode, String agency, String accountNumber);

    Flux<BankConnection> findByCompanyIdAndActiveTrue(UUID companyId);

    // never synced, or last sync older than the connection's own frequency (falls back to :defaultHours)
    @Query("""
            SELECT * FROM bank_connections
             WHERE is_active = TRUE
               AND status = :status
               AND (last_sync_at IS NULL
                    OR last_sync_at < :now - make_interval(hours => COALESCE(sync_frequency_hours, :defaultHours)))
            """)
    Flux<BankConnection> findDueForSync(String status, OffsetDateTime now, int defaultHours);

    @Modifying
    @Query("""
            UPDATE bank_connections
               SET access_token = :accessToken,
                   refresh_token = :refreshToken,
                   token_expires_at = :expiresAt,
                   status = 'ACTIVE',
                   status_message = NULL,
                   updated_at = :now
             WHERE id = :id
            """)
    Mono<Integer> updateTokens(UUID id, String accessToken, String refreshToken, OffsetDateTime expiresAt,
                               OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE bank_connections
               SET external_account_id = :externalAccountId,
                   current_balance = :currentBalance,
                   available_balance = :availableBalance,
                   currency = :currency,
                   status = 'ACTIVE',
                   status_message = NULL,
                   updated_at = :now
             WHERE id = :id
            """)
    Mono<Integer> updateAccountSnapshot(UUID id, String externalAccountId, BigDecimal currentBalance,
                                        BigDecimal availableBalance, String currency, OffsetDateTime now);

    @Modifying
    @Query("UPDATE bank_connections SET status = :status, status_message = :message, updated_at = :now WHERE id = :id")
    Mono<Integer> updateStatus(UUID id, String status, String message, OffsetDateTime now);

    @Modifying
    @Query("UPDATE bank_connections SET last_sync_at = :syncedAt, updated_at = :syncedAt WHERE id = :id")
    Mono<Integer> markSynced(UUID id, OffsetDateTime syncedAt);

    @Modifying
    @Query("UPDATE bank_connections SET is_active = FALSE, updated_at = :now WHERE id = :id")
    Mono<Integer> disable(UUID id, OffsetDateTime now);
}
