package com.bank_sync_engine.service.categorization;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * JSON shape of {@code category_rules.conditions}. Only the fields of the rule's type are set:
 * keyword uses {@code keywords}, amount_range {@code min_amount}/{@code max_amount} (major units,
 * compared against the absolute amount), counterpart {@code counterparts}, pattern {@code pattern}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RuleConditions(
        List<String> keywords,
        @JsonProperty("min_amount") BigDecimal minAmount,
        @JsonProperty("max_amount") BigDecimal maxAmount,
        List<String> counterparts,
        String pattern
) {
    public static RuleConditions keywords(List<String> keywords) {
        return new RuleConditions(keywords, null, null, null, null);
    }

    public static RuleConditions amountRange(BigDecimal min, BigDecimal max) {
        return new RuleConditions(null, min, max, null, null);
    }

    public static RuleConditions counterparts(List<String> counterparts) {
        return new RuleConditions(null, null, null, counterparts, null);
    }

    public static RuleConditions pattern(String pattern) {
        return new RuleConditions(null, null, null, null, pattern);
    }
}
