package com.bank_sync_engine.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Append-only log row, one per categorization attempt. Only {@code wasAccepted} and
 * {@code finalCategoryId} are filled in later, by review.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("categorization_decisions")
public class CategorizationDecision {

    @Id
    private UUID id;

    @Column("transaction_id")
    private UUID transactionId;

    @Column("company_id")
    private UUID companyId;

    @Column("method")
    private CategorizationMethod method;

    @Column("suggested_category_id")
    private UUID suggestedCategoryId;

    @Column("confidence")
    private Double confidence;

    @Column("rule_id")
    private UUID ruleId;

    @Column("classifier_name")
    private String classifierName;

    @Column("reason")
    private String reason;

    @Column("processing_time_ms")
    private Long processingTimeMs;

    // null until a human reviews the transaction
    @Column("was_accepted")
    private Boolean wasAccepted;

    @Column("final_category_id")
    private UUID finalCategoryId;

    @Column("created_at")
    private OffsetDateTime createdAt;
}
