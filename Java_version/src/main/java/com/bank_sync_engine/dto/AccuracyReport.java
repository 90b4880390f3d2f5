package com.bank_sync_engine.dto;

import com.bank_sync_engine.model.CategorizationMethod;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.OffsetDateTime;
import java.util.Map;

@Builder
public record AccuracyReport(
        @JsonProperty("period_start") OffsetDateTime periodStart,
        @JsonProperty("period_end") OffsetDateTime periodEnd,
        @JsonProperty("total_decisions") long totalDecisions,
        @JsonProperty("reviewed_decisions") long reviewedDecisions,
        @JsonProperty("accepted_decisions") long acceptedDecisions,
        @JsonProperty("overall_accuracy") Double overallAccuracy,
        @JsonProperty("by_method") Map<CategorizationMethod, MethodStats> byMethod
) {
    @Builder
    public record MethodStats(
            long total,
            long reviewed,
            long accepted,
            Double accuracy,
            @JsonProperty("average_confidence") Double averageConfidence
    ) {}
}
