package com.bank_sync_engine.repository;

import com.bank_sync_engine.model.CategorizationDecision;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.UUID;

public interface CategorizationDecisionRepository extends ReactiveCrudRepository<CategorizationDecision, UUID> {

    Mono<CategorizationDecision> findFirstByTransactionIdOrderByCreatedAtDesc(UUID transactionId);

    Flux<CategorizationDecision> findByCompanyId(UUID companyId);

    Flux<CategorizationDecision> findByCompanyIdAndCreatedAtBetween(UUID companyId, OffsetDateTime from, OffsetDateTime to);

    // Review outcome is the only part of a decision row that may change.
    @Modifying
    @Query("UPDATE categorization_decisions SET was_accepted = :accepted, final_category_id = :finalCategoryId WHERE id = :id")
    Mono<Integer> recordReview(UUID id, boolean accepted, UUID finalCategoryId);

    @Query("""
            SELECT rule_id AS key_id,
                   COUNT(*) FILTER (WHERE was_accepted IS NOT NULL) AS reviewed,
                   COUNT(*) FILTER (WHERE was_accepted) AS accepted
              FROM categorization_decisions
             WHERE rule_id IS NOT NULL
             GROUP BY rule_id
            """)
    Flux<ReviewAggregate> aggregateByRule();

    @Query("""
            SELECT suggested_category_id AS key_id,
                   COUNT(*) FILTER (WHERE was_accepted IS NOT NULL) AS reviewed,
                   COUNT(*) FILTER (WHERE was_accepted) AS accepted
              FROM categorization_decisions
             WHERE suggested_category_id IS NOT NULL
             GROUP BY suggested_category_id
            """)
    Flux<ReviewAggregate> aggregateByCategory();

    /** Review counts of the decisions sharing one rule or one suggested category. */
    record ReviewAggregate(UUID keyId, Long reviewed, Long accepted) {}
}
