package com.bank_sync_engine.exception;

import lombok.Getter;

import java.time.Duration;

@Getter
public class RateLimitedException extends BankSyncException {

    // provider supplied Retry-After, may be null
    private final Duration retryAfter;

    public RateLimitedException(String message, Duration retryAfter, Throwable cause) {
        super("RATE_LIMITED", message, true, cause);
        this.retryAfter = retryAfter;
    }
}
