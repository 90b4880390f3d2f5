package com.bank_sync_engine.service.sync;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-connection mutual exclusion for sync runs. Non-blocking: a connection already held is
 * reported back to the caller instead of queued. Scope is this process.
 */
@Component
public class SyncLockRegistry {

    private final Set<UUID> held = ConcurrentHashMap.newKeySet();

    public boolean tryAcquire(UUID connectionId) {
        return held.add(connectionId);
    }

    public void release(UUID connectionId) {
        held.remove(connectionId);
    }

    public boolean isHeld(UUID connectionId) {
        return held.contains(connectionId);
    }
}
