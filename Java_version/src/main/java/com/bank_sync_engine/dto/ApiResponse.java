package com.bank_sync_engine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/** Envelope for every /api/v1 response. {@code error} is only set when {@code success} is false. */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, T data, String error) {
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null);
    }
    public static <T> ApiResponse<T> fail(String message) {
        return new ApiResponse<>(false, null, message);
    }
}
