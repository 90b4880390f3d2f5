package com.bank_sync_engine.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;
import java.util.UUID;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("training_examples")
public class TrainingExample {

    @Id
    private UUID id;

    @Column("company_id")
    private UUID companyId;

    @Column("transaction_id")
    private UUID transactionId;

    @Column("description")
    private String description;

    // lower-cased, whitespace-collapsed description used for exact lookups
    @Column("normalized_description")
    private String normalizedDescription;

    @Column("amount")
    private Long amount;

    @Column("transaction_type")
    private TransactionType transactionType;

    @Column("counterpart_name")
    private String counterpartName;

    @Column("category_id")
    private UUID categoryId;

    @Column("is_verified")
    private Boolean verified;

    @Column("verification_source")
    private String verificationSource;

    @Column("verified_by")
    private UUID verifiedBy;

    // JSON object produced by FeatureExtractor
    @Column("features")
    private String features;

    @Column("created_at")
    private OffsetDateTime createdAt;
}
