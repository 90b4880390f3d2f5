package com.bank_sync_engine.openbanking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** RFC 6749 token endpoint error body. */
public record ObTokenError(
        String error,
        @JsonProperty("error_description") String errorDescription
) {}
