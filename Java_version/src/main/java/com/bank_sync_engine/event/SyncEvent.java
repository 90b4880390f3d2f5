package com.bank_sync_engine.event;

import java.util.UUID;

/** Marker for everything the sync orchestrator publishes after a commit. */
public interface SyncEvent {

    UUID connectionId();

    UUID companyId();
}
