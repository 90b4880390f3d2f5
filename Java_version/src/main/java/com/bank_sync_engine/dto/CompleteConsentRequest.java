package com.bank_sync_engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Request body for POST /api/v1/connections, sent after the bank redirected back
 * with {@code code} and {@code state}.
 */
public record CompleteConsentRequest(
        @NotBlank String state,
        @NotBlank String code,
        @NotBlank @Pattern(regexp = "\\d{4}", message = "agency must have 4 digits") String agency,
        @NotBlank @JsonProperty("account_number") String accountNumber,
        @JsonProperty("account_type") String accountType
) {}
