package com.bank_sync_engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

@Builder
public record ConsentResponse(
        @JsonProperty("consent_id") String consentId,
        @JsonProperty("authorization_url") String authorizationUrl,
        @JsonProperty("state") String state,
        @JsonProperty("expires_in") long expiresIn
) {}
