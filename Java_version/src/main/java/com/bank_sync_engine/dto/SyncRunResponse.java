package com.bank_sync_engine.dto;

import com.bank_sync_engine.model.SyncRun;
import com.bank_sync_engine.model.SyncStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

@Builder
public record SyncRunResponse(
        UUID id,
        @JsonProperty("connection_id") UUID connectionId,
        SyncStatus status,
        @JsonProperty("from_date") LocalDate fromDate,
        @JsonProperty("to_date") LocalDate toDate,
        @JsonProperty("transactions_found") int transactionsFound,
        @JsonProperty("transactions_new") int transactionsNew,
        @JsonProperty("transactions_updated") int transactionsUpdated,
        @JsonProperty("transactions_skipped") int transactionsSkipped,
        @JsonProperty("error_code") String errorCode,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("started_at") OffsetDateTime startedAt,
        @JsonProperty("completed_at") OffsetDateTime completedAt
) {
    public static SyncRunResponse from(SyncRun run) {
        return SyncRunResponse.builder()
                .id(run.getId())
                .connectionId(run.getConnectionId())
                .status(run.getStatus())
                .fromDate(run.getFromDate())
                .toDate(run.getToDate())
                .transactionsFound(orZero(run.getTransactionsFound()))
                .transactionsNew(orZero(run.getTransactionsNew()))
                .transactionsUpdated(orZero(run.getTransactionsUpdated()))
                .transactionsSkipped(orZero(run.getTransactionsSkipped()))
                .errorCode(run.getErrorCode())
                .errorMessage(run.getErrorMessage())
                .startedAt(run.getStartedAt())
                .completedAt(run.getCompletedAt())
                .build();
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }
}
