package com.bank_sync_engine.dto;

import com.bank_sync_engine.model.CategorizationMethod;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.UUID;

/**
 * Outcome of one categorization attempt. {@code method} is never {@code manual} here.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CategorizationResult(
        @JsonProperty("category_id") UUID categoryId,
        double confidence,
        CategorizationMethod method,
        String reason,
        @JsonProperty("rule_id") UUID ruleId
) {}
