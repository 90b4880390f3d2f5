package com.bank_sync_engine.dto;

import com.bank_sync_engine.model.CategoryRule;
import com.bank_sync_engine.model.RuleType;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import lombok.Builder;

import java.time.OffsetDateTime;
import java.util.UUID;

@Builder
public record RuleResponse(
        UUID id,
        String name,
        @JsonProperty("category_id") UUID categoryId,
        @JsonProperty("rule_type") RuleType ruleType,
        @JsonRawValue String conditions,
        int priority,
        @JsonProperty("confidence_threshold") Double confidenceThreshold,
        @JsonProperty("match_count") int matchCount,
        @JsonProperty("accuracy_rate") Double accuracyRate,
        boolean active,
        @JsonProperty("created_at") OffsetDateTime createdAt
) {
    public static RuleResponse from(CategoryRule rule) {
        return RuleResponse.builder()
                .id(rule.getId())
                .name(rule.getName())
                .categoryId(rule.getCategoryId())
                .ruleType(rule.getRuleType())
                .conditions(rule.getConditions())
                .priority(rule.getPriority() != null ? rule.getPriority() : 0)
                .confidenceThreshold(rule.getConfidenceThreshold())
                .matchCount(rule.getMatchCount() != null ? rule.getMatchCount() : 0)
                .accuracyRate(rule.getAccuracyRate())
                .active(Boolean.TRUE.equals(rule.getActive()))
                .createdAt(rule.getCreatedAt())
                .build();
    }
}
