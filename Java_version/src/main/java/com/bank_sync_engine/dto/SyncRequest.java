package com.bank_sync_engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/** Optional body for POST /api/v1/connections/{id}/sync. */
public record SyncRequest(
        @Min(1) @Max(365) @JsonProperty("days_back") Integer daysBack
) {}
