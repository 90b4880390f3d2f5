package com.bank_sync_engine.service.sync;

import com.bank_sync_engine.config.SyncProperties;
import com.bank_sync_engine.event.BalanceChangedEvent;
import com.bank_sync_engine.event.TransactionEventPublisher;
import com.bank_sync_engine.event.TransactionUpsertedEvent;
import com.bank_sync_engine.exception.AuthException;
import com.bank_sync_engine.exception.BankSyncException;
import com.bank_sync_engine.exception.InvalidGrantException;
import com.bank_sync_engine.exception.ResourceNotFoundException;
import com.bank_sync_engine.exception.SyncAlreadyRunningException;
import com.bank_sync_engine.exception.SyncTimeoutException;
import com.bank_sync_engine.exception.ValidationException;
import com.bank_sync_engine.model.BankConnection;
import com.bank_sync_engine.model.CanonicalTransaction;
import com.bank_sync_engine.model.ConnectionStatus;
import com.bank_sync_engine.model.SyncRun;
import com.bank_sync_engine.model.SyncStatus;
import com.bank_sync_engine.openbanking.AccountGateway;
import com.bank_sync_engine.openbanking.AccountInfo;
import com.bank_sync_engine.openbanking.RawTransaction;
import com.bank_sync_engine.repository.BankConnectionRepository;
import com.bank_sync_engine.repository.SyncRunRepository;
import com.bank_sync_engine.repository.TransactionRepository;
import com.bank_sync_engine.service.TokenRefreshCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SynchronousSink;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One synchronization pass per connection: balances, then every transaction in the window, upserted
 * by (connection, external id) in committed batches. The run is finalized exactly once, and only
 * after every batch it counts has committed.
 * <p>
 * Fails fast: retrying is the scheduler's job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncOrchestrator {

    private static final int MAX_ERROR_MESSAGE = 1000;
    static final String SYNC_CANCELLED = "SYNC_CANCELLED";

    private final BankConnectionRepository connectionRepository;
    private final TransactionRepository transactionRepository;
    private final SyncRunRepository syncRunRepository;
    private final AccountGateway accountGateway;
    private final TokenRefreshCoordinator tokenRefreshCoordinator;
    private final SyncLockRegistry lockRegistry;
    private final TransactionEventPublisher eventPublisher;
    private final TransactionalOperator transactionalOperator;
    private final SyncProperties props;
    private final Clock clock;

    public Mono<SyncRun> syncConnection(UUID connectionId) {
        return syncConnection(connectionId, props.getDaysBack());
    }

    /**
     * Runs one sync of {@code connectionId} over the last {@code daysBack} days. Fails with
     * {@link SyncAlreadyRunningException} without touching anything when a sync of the same
     * connection is in progress.
     */
    public Mono<SyncRun> syncConnection(UUID connectionId, int daysBack) {
        return Mono.defer(() -> {
            if (!lockRegistry.tryAcquire(connectionId)) {
                log.info("Sync of connection {} skipped: already running", connectionId);
                return Mono.error(new SyncAlreadyRunningException(connectionId));
            }
            return connectionRepository.findById(connectionId)
                    .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Connection", connectionId)))
                    .flatMap(connection -> {
                        if (!Boolean.TRUE.equals(connection.getActive())) {
                            return Mono.error(new ValidationException("Connection " + connectionId + " is disabled"));
                        }
                        return openRun(connection, daysBack).flatMap(run -> execute(connection, run));
                    })
                    .doFinally(signal -> lockRegistry.release(connectionId));
        });
    }

    public Flux<SyncRun> recentRuns(UUID connectionId) {
        return syncRunRepository.findTop20ByConnectionIdOrderByStartedAtDesc(connectionId);
    }

    private Mono<SyncRun> openRun(BankConnection connection, int daysBack) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        LocalDate today = now.toLocalDate();
        return syncRunRepository.save(SyncRun.builder()
                .connectionId(connection.getId())
                .status(SyncStatus.RUNNING)
                .fromDate(today.minusDays(daysBack))
                .toDate(today)
                .transactionsFound(0)
                .transactionsNew(0)
                .transactionsUpdated(0)
                .transactionsSkipped(0)
                .startedAt(now)
                .build());
    }

    private Mono<SyncRun> execute(BankConnection connection, SyncRun run) {
        SyncCounters counters = new SyncCounters();
        log.info("Sync {} started for connection {} window [{}, {}]",
                run.getId(), connection.getId(), run.getFromDate(), run.getToDate());

        return tokenRefreshCoordinator.ensureFresh(connection)
                .flatMap(this::refreshAccount)
                .flatMap(synced -> ingestTransactions(synced, run, counters))
                .timeout(props.getMaxDuration())
                .then(Mono.defer(() -> complete(run, connection, counters)))
                .onErrorResume(error -> fail(run, connection, counters, error))
                .doOnCancel(() -> cancelled(run, connection, counters));
    }

    private record Snapshot(BankConnection connection, AccountInfo info) {}

    // Balance fetch; one refresh-and-retry on an auth error
    private Mono<BankConnection> refreshAccount(BankConnection connection) {
        return accountGateway.getAccountInfo(connection)
                .map(info -> new Snapshot(connection, info))
                .onErrorResume(AuthException.class, e -> {
                    log.warn("Account fetch for connection {} rejected, refreshing token", connection.getId());
                    return tokenRefreshCoordinator.refresh(connection)
                            .flatMap(refreshed -> accountGateway.getAccountInfo(refreshed)
                                    .map(info -> new Snapshot(refreshed, info)));
                })
                .flatMap(this::applySnapshot);
    }

    private Mono<BankConnection> applySnapshot(Snapshot snapshot) {
        BankConnection connection = snapshot.connection();
        AccountInfo info = snapshot.info();
        OffsetDateTime now = OffsetDateTime.now(clock);
        String externalAccountId = info.externalAccountId() != null
                ? info.externalAccountId() : connection.getExternalAccountId();
        String currency = info.currency() != null ? info.currency() : connection.getCurrency();
        BigDecimal previous = connection.getCurrentBalance();

        BankConnection updated = connection.toBuilder()
                .externalAccountId(externalAccountId)
                .currentBalance(info.balance())
                .availableBalance(info.availableBalance())
                .currency(currency)
                .status(ConnectionStatus.ACTIVE)
                .statusMessage(null)
                .updatedAt(now)
                .build();

        return connectionRepository.updateAccountSnapshot(connection.getId(), externalAccountId,
                        info.balance(), info.availableBalance(), currency, now)
                .then(Mono.fromSupplier(() -> {
                    if (info.balance() != null && (previous == null || previous.compareTo(info.balance()) != 0)) {
                        eventPublisher.publish(new BalanceChangedEvent(connection.getId(), connection.getCompanyId(),
                                previous, info.balance(), info.availableBalance(), currency));
                    }
                    return updated;
                }));
    }

    private Mono<Void> ingestTransactions(BankConnection connection, SyncRun run, SyncCounters counters) {
        AtomicBoolean received = new AtomicBoolean();
        Flux<RawTransaction> raw = accountGateway.getTransactions(connection, run.getFromDate(), run.getToDate())
                .doOnNext(r -> received.set(true))
                // replaying a half-consumed stream would count rows twice, so only retry before the first item
                .onErrorResume(e -> e instanceof AuthException && !received.get(), e -> {
                    log.warn("Transaction fetch for connection {} rejected, refreshing token", connection.getId());
                    return tokenRefreshCoordinator.refresh(connection)
                            .flatMapMany(refreshed -> accountGateway.getTransactions(
                                    refreshed, run.getFromDate(), run.getToDate()));
                });

        return raw
                .doOnNext(r -> counters.found.incrementAndGet())
                .handle((RawTransaction r, SynchronousSink<CanonicalTransaction> sink) -> {
                    try {
                        sink.next(TransactionNormalizer.normalize(r, connection));
                    } catch (ValidationException e) {
                        counters.skipped.incrementAndGet();
                        log.warn("Skipping transaction from connection {}: {}", connection.getId(), e.getMessage());
                    }
                })
                .buffer(props.getBatchSize())
                .concatMap(batch -> upsertBatch(batch)
                        .doOnNext(outcomes -> afterCommit(outcomes, counters)))
                .then();
    }

    private record UpsertOutcome(CanonicalTransaction transaction, boolean created) {}

    // collectList completes only after the transaction has committed
    private Mono<List<UpsertOutcome>> upsertBatch(List<CanonicalTransaction> batch) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return Flux.fromIterable(batch)
                .concatMap(t -> upsert(t, now))
                .as(transactionalOperator::transactional)
                .collectList();
    }

    private Mono<UpsertOutcome> upsert(CanonicalTransaction incoming, OffsetDateTime now) {
        return transactionRepository.findByConnectionIdAndExternalId(incoming.getConnectionId(), incoming.getExternalId())
                .flatMap(existing -> {
                    CanonicalTransaction merged = incoming.toBuilder()
                            .id(existing.getId())
                            .categoryId(existing.getCategoryId())
                            .categoryConfidence(existing.getCategoryConfidence())
                            .aiCategorized(existing.getAiCategorized())
                            .manuallyReviewed(existing.getManuallyReviewed())
                            .createdAt(existing.getCreatedAt())
                            .updatedAt(now)
                            .build();
                    return transactionRepository.updateProviderFields(merged)
                            .thenReturn(new UpsertOutcome(merged, false));
                })
                .switchIfEmpty(Mono.defer(() -> transactionRepository.save(incoming.toBuilder()
                                .aiCategorized(false)
                                .manuallyReviewed(false)
                                .createdAt(now)
                                .updatedAt(now)
                                .build())
                        .map(saved -> new UpsertOutcome(saved, true))));
    }

    private void afterCommit(List<UpsertOutcome> outcomes, SyncCounters counters) {
        for (UpsertOutcome outcome : outcomes) {
            (outcome.created() ? counters.created : counters.updated).incrementAndGet();
            CanonicalTransaction t = outcome.transaction();
            eventPublisher.publish(new TransactionUpsertedEvent(t.getId(), t.getConnectionId(), t.getCompanyId(),
                    outcome.created(), t.getCategoryId() != null));
        }
    }

    private Mono<SyncRun> complete(SyncRun run, BankConnection connection, SyncCounters counters) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        SyncStatus status = counters.skipped.get() > 0 ? SyncStatus.PARTIAL : SyncStatus.COMPLETED;
        SyncRun finished = counters.applyTo(run.toBuilder())
                .status(status)
                .errorMessage(status == SyncStatus.PARTIAL
                        ? counters.skipped.get() + " transactions skipped by validation" : null)
                .completedAt(now)
                .build();

        return syncRunRepository.finalizeRun(finished)
                .then(connectionRepository.markSynced(connection.getId(), now))
                .doOnSuccess(x -> log.info("Sync {} for connection {} {}: found={} new={} updated={} skipped={}",
                        run.getId(), connection.getId(), status.wireValue(), finished.getTransactionsFound(),
                        finished.getTransactionsNew(), finished.getTransactionsUpdated(),
                        finished.getTransactionsSkipped()))
                .thenReturn(finished);
    }

    private Mono<SyncRun> fail(SyncRun run, BankConnection connection, SyncCounters counters, Throwable error) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        BankSyncException cause = translate(error);
        String message = truncate(cause.getMessage());
        SyncRun failed = counters.applyTo(run.toBuilder())
                .status(SyncStatus.FAILED)
                .errorCode(cause.getErrorCode())
                .errorMessage(message)
                .completedAt(now)
                .build();

        log.error("Sync {} for connection {} failed after new={} updated={}: {}",
                run.getId(), connection.getId(), failed.getTransactionsNew(), failed.getTransactionsUpdated(), message);

        // an invalid grant already left the connection expired, which is the more precise state
        Mono<Integer> statusUpdate = cause instanceof InvalidGrantException
                ? Mono.just(0)
                : connectionRepository.updateStatus(connection.getId(), ConnectionStatus.ERROR.name(), message, now);

        return syncRunRepository.finalizeRun(failed)
                .then(statusUpdate)
                .then(Mono.<SyncRun>error(cause));
    }

    /**
     * The subscriber went away mid-run, e.g. an HTTP client disconnecting. The run is closed on a
     * detached subscription; the conditional finalize leaves it alone if it already reached a
     * terminal state. The connection itself is not at fault, so its status is not touched.
     */
    private void cancelled(SyncRun run, BankConnection connection, SyncCounters counters) {
        SyncRun failed = counters.applyTo(run.toBuilder())
                .status(SyncStatus.FAILED)
                .errorCode(SYNC_CANCELLED)
                .errorMessage("Sync cancelled before completion")
                .completedAt(OffsetDateTime.now(clock))
                .build();
        syncRunRepository.finalizeRun(failed)
                .subscribe(
                        updated -> {
                            if (updated > 0) {
                                log.warn("Sync {} for connection {} cancelled after new={} updated={}",
                                        run.getId(), connection.getId(), failed.getTransactionsNew(),
                                        failed.getTransactionsUpdated());
                            }
                        },
                        e -> log.error("Failed to close cancelled sync {}: {}", run.getId(), e.getMessage()));
    }

    private BankSyncException translate(Throwable error) {
        if (error instanceof BankSyncException bse) {
            return bse;
        }
        if (error instanceof TimeoutException) {
            return new SyncTimeoutException(props.getMaxDuration(), error);
        }
        return new BankSyncException("SYNC_ERROR", "Sync failed: " + error.getMessage(), false, error);
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= MAX_ERROR_MESSAGE ? message : message.substring(0, MAX_ERROR_MESSAGE);
    }
}
