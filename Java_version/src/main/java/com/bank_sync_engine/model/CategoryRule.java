package com.bank_sync_engine.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.UUID;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("category_rules")
public class CategoryRule {

    /** Evaluation order: priority descending, then name ascending. */
    public static final Comparator<CategoryRule> EVALUATION_ORDER =
            Comparator.comparing((CategoryRule r) -> r.getPriority() == null ? 0 : r.getPriority(),
                            Comparator.reverseOrder())
                    .thenComparing(r -> r.getName() == null ? "" : r.getName());

    @Id
    private UUID id;

    @Column("company_id")
    private UUID companyId;

    @Column("category_id")
    private UUID categoryId;

    @Column("name")
    private String name;

    @Column("rule_type")
    private RuleType ruleType;

    // JSON object, shape depends on rule_type (see RuleConditions)
    @Column("conditions")
    private String conditions;

    @Column("priority")
    private Integer priority;

    @Column("confidence_threshold")
    private Double confidenceThreshold;

    @Column("match_count")
    private Integer matchCount;

    @Column("accuracy_rate")
    private Double accuracyRate;

    @Column("is_active")
    private Boolean active;

    @Column("created_at")
    private OffsetDateTime createdAt;

    @Column("updated_at")
    private OffsetDateTime updatedAt;
}
