package com.bank_sync_engine.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Provider-independent bank transaction. Identity is (connection_id, external_id), unique and
 * never rewritten. Amounts are signed minor units: positive is a credit, negative a debit.
 * <p>
 * Field ownership: the sync orchestrator writes the provider fields, the categorization pipeline
 * writes the category fields, the feedback learner writes the review flag.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("transactions")
public class CanonicalTransaction {

    public static final String STATUS_COMPLETED = "completed";

    @Id
    private UUID id;

    @Column("connection_id")
    private UUID connectionId;

    @Column("company_id")
    private UUID companyId;

    @Column("external_id")
    private String externalId;

    @Column("transaction_type")
    private TransactionType transactionType;

    @Column("amount")
    private Long amount;

    @Column("currency")
    private String currency;

    @Column("description")
    private String description;

    @Column("occurred_at")
    private OffsetDateTime occurredAt;

    @Column("counterpart_name")
    private String counterpartName;

    @Column("counterpart_document")
    private String counterpartDocument;

    @Column("reference_number")
    private String referenceNumber;

    @Column("balance_after")
    private Long balanceAfter;

    @Column("status")
    private String status;

    @Column("category_id")
    private UUID categoryId;

    @Column("category_confidence")
    private Double categoryConfidence;

    @Column("is_ai_categorized")
    private Boolean aiCategorized;

    @Column("is_manually_reviewed")
    private Boolean manuallyReviewed;

    @Column("created_at")
    private OffsetDateTime createdAt;

    @Column("updated_at")
    private OffsetDateTime updatedAt;

    public boolean isIncome() {
        return amount != null && amount > 0;
    }

    /** Absolute amount in major units (two decimal places). */
    public BigDecimal absoluteAmount() {
        return amount == null ? BigDecimal.ZERO : BigDecimal.valueOf(Math.abs(amount), 2);
    }
}
