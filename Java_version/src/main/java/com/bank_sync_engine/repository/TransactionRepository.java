package com.bank_sync_engine.repository;

import com.bank_sync_engine.model.CanonicalTransaction;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Updates are row-scoped and touch one owner's field set each, so concurrent writers on the same
 * row never overwrite each other's columns.
 */
public interface TransactionRepository extends ReactiveCrudRepository<CanonicalTransaction, UUID>,
        TransactionProviderFieldsUpdater {

    Mono<CanonicalTransaction> findByConnectionIdAndExternalId(UUID connectionId, String externalId);

    @Modifying
    @Query("""
            UPDATE transactions
               SET category_id = :categoryId,
                   category_confidence = :confidence,
                   is_ai_categorized = TRUE,
                   updated_at = :now
             WHERE id = :id
               AND is_manually_reviewed = FALSE
            """)
    Mono<Integer> applyCategorization(UUID id, UUID categoryId, double confidence, OffsetDateTime now);

    @Modifying
    @Query("""
            UPDATE transactions
               SET category_id = :categoryId,
                   category_confidence = 1.0,
                   is_ai_categorized = FALSE,
                   is_manually_reviewed = TRUE,
                   updated_at = :now
             WHERE id = :id
            """)
    Mono<Integer> applyManualReview(UUID id, UUID categoryId, OffsetDateTime now);

    @Query("""
            SELECT * FROM transactions
             WHERE company_id = :companyId
               AND category_id IS NULL
               AND is_manually_reviewed = FALSE
             ORDER BY occurred_at DESC
             LIMIT :limit
            """)
    Flux<CanonicalTransaction> findUncategorized(UUID companyId, int limit);

    @Query("""
            SELECT * FROM transactions
             WHERE category_id IS NULL
               AND is_manually_reviewed = FALSE
             ORDER BY occurred_at DESC
             LIMIT :limit
            """)
    Flux<CanonicalTransaction> findAllUncategorized(int limit);

    @Query("""
            SELECT * FROM transactions
             WHERE company_id = :companyId
               AND is_ai_categorized = TRUE
               AND is_manually_reviewed = FALSE
               AND category_confidence < :threshold
             ORDER BY occurred_at DESC
             LIMIT :limit
            """)
    Flux<CanonicalTransaction> findLowConfidence(UUID companyId, double threshold, int limit);

    @Query("""
            SELECT * FROM transactions
             WHERE company_id = :companyId
             ORDER BY occurred_at DESC
             LIMIT :limit
            """)
    Flux<CanonicalTransaction> findRecentByCompany(UUID companyId, int limit);

    @Query("""
            SELECT description, category_id, COUNT(*) AS occurrences
              FROM transactions
             WHERE company_id = :companyId
               AND category_id IS NOT NULL
             GROUP BY description, category_id
            HAVING COUNT(*) >= :minOccurrences
             ORDER BY occurrences DESC
             LIMIT 20
            """)
    Flux<DescriptionFrequency> findFrequentCategorizedDescriptions(UUID companyId, int minOccurrences);

    /** Projection for {@link #findFrequentCategorizedDescriptions}. */
    record DescriptionFrequency(String description, UUID categoryId, Long occurrences) {}
}
