package com.bank_sync_engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a {@link SyncRun}: {@code RUNNING} until it is finalized once with one of the
 * terminal values.
 */
public enum SyncStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    PARTIAL;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }
}
