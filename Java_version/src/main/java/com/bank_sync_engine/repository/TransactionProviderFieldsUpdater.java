package com.bank_sync_engine.repository;

import com.bank_sync_engine.model.CanonicalTransaction;
import reactor.core.publisher.Mono;

/**
 * Rewrites only the provider-owned columns of an existing transaction. Category and review
 * columns are left as they are.
 */
public interface TransactionProviderFieldsUpdater {

    Mono<Long> updateProviderFields(CanonicalTransaction transaction);
}
