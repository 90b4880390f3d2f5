package com.bank_sync_engine.exception;

public class ProviderNotFoundException extends BankSyncException {

    public ProviderNotFoundException(String providerCode) {
        super("PROVIDER_NOT_FOUND", "Bank provider " + providerCode + " not found or inactive", false);
    }
}
