package com.bank_sync_engine.exception;

public class InvalidGrantException extends BankSyncException {

    public InvalidGrantException(String message) {
        super("INVALID_GRANT", message, false);
    }

    public InvalidGrantException(String message, Throwable cause) {
        super("INVALID_GRANT", message, false, cause);
    }
}
