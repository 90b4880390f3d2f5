package com.bank_sync_engine.exception;

public class ResourceNotFoundException extends BankSyncException {

    public ResourceNotFoundException(String resource, Object id) {
        super("NOT_FOUND", resource + " " + id + " not found", false);
    }
}
