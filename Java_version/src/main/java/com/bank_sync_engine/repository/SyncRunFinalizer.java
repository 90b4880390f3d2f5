package com.bank_sync_engine.repository;

import com.bank_sync_engine.model.SyncRun;
import reactor.core.publisher.Mono;

public interface SyncRunFinalizer {

    /**
     * Moves a running run to its terminal state. Returns 0 when the run was already finalized,
     * so a terminal run is never rewritten.
     */
    Mono<Long> finalizeRun(SyncRun run);
}
