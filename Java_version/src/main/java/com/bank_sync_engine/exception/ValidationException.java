package com.bank_sync_engine.exception;

public class ValidationException extends BankSyncException {

    public ValidationException(String message) {
        super("VALIDATION_ERROR", message, false);
    }
}
