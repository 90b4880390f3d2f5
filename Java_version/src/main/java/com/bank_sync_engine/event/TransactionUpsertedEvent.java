package com.bank_sync_engine.event;

import java.util.UUID;

/**
 * One transaction row written by a sync batch. {@code created} is false when an existing row was
 * updated in place.
 */
public record TransactionUpsertedEvent(
        UUID transactionId,
        UUID connectionId,
        UUID companyId,
        boolean created,
        boolean categorized
) implements SyncEvent {}
