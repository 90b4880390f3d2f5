package com.bank_sync_engine.service.sync;

import com.bank_sync_engine.model.SyncRun;

import java.util.concurrent.atomic.AtomicInteger;

/** Running totals of one sync run; shared by the success and failure paths. */
class SyncCounters {

    final AtomicInteger found = new AtomicInteger();
    final AtomicInteger created = new AtomicInteger();
    final AtomicInteger updated = new AtomicInteger();
    final AtomicInteger skipped = new AtomicInteger();

    SyncRun.SyncRunBuilder applyTo(SyncRun.SyncRunBuilder builder) {
        return builder
                .transactionsFound(found.get())
                .transactionsNew(created.get())
                .transactionsUpdated(updated.get())
                .transactionsSkipped(skipped.get());
    }
}
