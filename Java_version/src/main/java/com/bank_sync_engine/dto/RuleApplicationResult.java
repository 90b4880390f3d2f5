package com.bank_sync_engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/** {@code matched} counts every match; {@code applied} only the uncategorized rows the rule filled in. */
public record RuleApplicationResult(
        @JsonProperty("rule_id") UUID ruleId,
        int examined,
        int matched,
        int applied
) {}
