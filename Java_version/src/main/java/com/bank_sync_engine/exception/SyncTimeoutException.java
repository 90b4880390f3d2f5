package com.bank_sync_engine.exception;

import java.time.Duration;

public class SyncTimeoutException extends BankSyncException {

    public SyncTimeoutException(Duration budget, Throwable cause) {
        super("SYNC_TIMEOUT", "Sync exceeded maximum duration of " + budget, false, cause);
    }
}
