package com.bank_sync_engine.exception;

import lombok.Getter;

/**
 * Root of the engine's error taxonomy. Transport and provider failures are translated into a
 * subclass before they reach the sync orchestrator.
 */
@Getter
public class BankSyncException extends RuntimeException {

    private final String errorCode;
    private final boolean retryable;

    public BankSyncException(String errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public BankSyncException(String errorCode, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }
}
