package com.bank_sync_engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.UUID;

/**
 * Request body for POST /api/v1/connections/consent.
 * {@code permissions} falls back to the configured scopes when empty.
 */
public record ConsentRequest(
        @NotNull @JsonProperty("company_id") UUID companyId,
        @NotBlank @JsonProperty("provider_code") String providerCode,
        List<String> permissions
) {}
