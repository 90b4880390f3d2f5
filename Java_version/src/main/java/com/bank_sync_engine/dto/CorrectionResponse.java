package com.bank_sync_engine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.UUID;

/** {@code was_accepted} is null when the transaction had no earlier automatic decision. */
@Builder
public record CorrectionResponse(
        @JsonProperty("transaction_id") UUID transactionId,
        @JsonProperty("previous_category_id") UUID previousCategoryId,
        @JsonProperty("category_id") UUID categoryId,
        @JsonProperty("was_accepted") Boolean wasAccepted,
        @JsonProperty("training_example_id") UUID trainingExampleId
) {}
