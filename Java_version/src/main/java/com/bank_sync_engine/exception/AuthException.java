package com.bank_sync_engine.exception;

/**
 * Access token missing, expired or rejected. Callers refresh the connection and try again.
 */
public class AuthException extends BankSyncException {

    public AuthException(String message) {
        super("AUTH_ERROR", message, false);
    }

    public AuthException(String message, Throwable cause) {
        super("AUTH_ERROR", message, false, cause);
    }
}
