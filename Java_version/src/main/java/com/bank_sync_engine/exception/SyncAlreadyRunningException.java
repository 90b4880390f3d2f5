package com.bank_sync_engine.exception;

import java.util.UUID;

/**
 * Another sync holds the connection's lock. Callers skip this round instead of retrying.
 */
public class SyncAlreadyRunningException extends BankSyncException {

    public SyncAlreadyRunningException(UUID connectionId) {
        super("SYNC_ALREADY_RUNNING", "A sync is already running for connection " + connectionId, false);
    }
}
