package com.bank_sync_engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record CorrectionRequest(
        @NotNull @JsonProperty("category_id") UUID categoryId,
        @JsonProperty("reviewer_id") UUID reviewerId
) {}
