package com.bank_sync_engine.dto;

import com.bank_sync_engine.model.RuleType;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Request body for POST /api/v1/companies/{companyId}/rules. Which of the condition fields are
 * required depends on {@code rule_type}.
 */
public record CreateRuleRequest(
        @NotBlank String name,
        @NotNull @JsonProperty("category_id") UUID categoryId,
        @NotNull @JsonProperty("rule_type") RuleType ruleType,
        List<String> keywords,
        @JsonProperty("min_amount") BigDecimal minAmount,
        @JsonProperty("max_amount") BigDecimal maxAmount,
        List<String> counterparts,
        String pattern,
        Integer priority,
        @DecimalMin("0.0") @DecimalMax("1.0") @JsonProperty("confidence_threshold") Double confidenceThreshold
) {}
