package com.bank_sync_engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

@Builder(toBuilder = true)
public record BulkCategorizationResult(
        int processed,
        int categorized,
        @JsonProperty("by_rule") int byRule,
        @JsonProperty("by_classifier") int byClassifier,
        @JsonProperty("by_default") int byDefault,
        int errors
) {}
