package com.bank_sync_engine.exception;

public class ProviderUnavailableException extends BankSyncException {

    public ProviderUnavailableException(String message, Throwable cause) {
        super("PROVIDER_UNAVAILABLE", message, true, cause);
    }

    /** For 4xx answers that will not succeed on a retry. */
    public ProviderUnavailableException(String message, boolean retryable, Throwable cause) {
        super("PROVIDER_UNAVAILABLE", message, retryable, cause);
    }
}
