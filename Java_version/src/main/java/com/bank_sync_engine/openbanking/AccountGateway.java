package com.bank_sync_engine.openbanking;

import com.bank_sync_engine.model.BankConnection;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

/**
 * Reads account identity, balances and transactions through the connection's current access
 * token. An absent or expired token fails with {@code AuthException}; refreshing is the caller's job.
 */
public interface AccountGateway {

    Mono<AccountInfo> getAccountInfo(BankConnection connection);

    /**
     * All transactions booked in {@code [from, to]}, following provider pagination until exhausted.
     * Provider type codes are already mapped to the canonical enum.
     */
    Flux<RawTransaction> getTransactions(BankConnection connection, LocalDate from, LocalDate to);
}
