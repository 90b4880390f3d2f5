package com.bank_sync_engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;
import java.util.UUID;

@Builder
public record RuleSuggestion(
        @JsonProperty("category_id") UUID categoryId,
        List<String> keywords,
        @JsonProperty("sample_description") String sampleDescription,
        long occurrences,
        double confidence
) {}
