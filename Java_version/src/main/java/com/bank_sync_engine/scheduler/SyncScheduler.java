package com.bank_sync_engine.scheduler;

import com.bank_sync_engine.config.SyncProperties;
import com.bank_sync_engine.exception.SyncAlreadyRunningException;
import com.bank_sync_engine.model.ConnectionStatus;
import com.bank_sync_engine.model.SyncRun;
import com.bank_sync_engine.model.SyncStatus;
import com.bank_sync_engine.repository.BankConnectionRepository;
import com.bank_sync_engine.repository.SyncRunRepository;
import com.bank_sync_engine.service.categorization.BulkCategorizationService;
import com.bank_sync_engine.service.feedback.CategorizationAccuracyService;
import com.bank_sync_engine.service.sync.SyncOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Background jobs. Each job subscribes and returns; failures are logged and the next tick starts
 * fresh.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncScheduler {

    static final String SKIPPED = "skipped";
    static final String FAILED = "failed";

    private final BankConnectionRepository connectionRepository;
    private final SyncRunRepository syncRunRepository;
    private final SyncOrchestrator syncOrchestrator;
    private final SyncRetryPolicy retryPolicy;
    private final BulkCategorizationService bulkCategorizationService;
    private final CategorizationAccuracyService accuracyService;
    private final SyncProperties props;
    private final Clock clock;

    /**
     * Syncs every active connection whose last sync is older than its frequency, at most
     * {@code sync.worker-concurrency} at a time.
     */
    @Scheduled(fixedDelayString = "${sync.schedule-delay-millis:900000}", initialDelayString = "${sync.schedule-initial-delay-millis:60000}")
    public void syncDueConnections() {
        log.info("=== Scheduled Job: Sync Due Connections ===");
        runDueSyncs().subscribe(
                outcomes -> log.info("Scheduled sync finished: {}", outcomes),
                e -> log.error("Error running scheduled syncs", e));
    }

    /** Outcome counts keyed by final run status, plus {@code skipped} and {@code failed}. */
    public Mono<Map<String, Long>> runDueSyncs() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return connectionRepository.findDueForSync(ConnectionStatus.ACTIVE.name(), now, props.getSyncFrequencyHours())
                .flatMap(connection -> syncOrchestrator.syncConnection(connection.getId())
                                .retryWhen(retryPolicy.retrySpec())
                                .map(SyncRun::getStatus)
                                .map(SyncStatus::wireValue)
                                .onErrorResume(SyncAlreadyRunningException.class, e -> Mono.just(SKIPPED))
                                .onErrorResume(e -> {
                                    log.warn("Scheduled sync of connection {} failed: {}", connection.getId(), e.getMessage());
                                    return Mono.just(FAILED);
                                }),
                        props.getWorkerConcurrency())
                .collect(Collectors.groupingBy(Function.identity(), Collectors.counting()));
    }

    @Scheduled(fixedDelayString = "${categorization.sweep-delay-millis:300000}", initialDelayString = "${categorization.sweep-initial-delay-millis:120000}")
    public void sweepUncategorized() {
        log.info("=== Scheduled Job: Categorize Leftover Transactions ===");
        bulkCategorizationService.sweepUncategorized().subscribe(
                result -> log.info("Sweep categorized {} of {} transactions ({} errors)",
                        result.categorized(), result.processed(), result.errors()),
                e -> log.error("Error sweeping uncategorized transactions", e));
    }

    /** Nightly at 03:00. */
    @Scheduled(cron = "${categorization.accuracy-cron:0 0 3 * * *}")
    public void recomputeAccuracy() {
        log.info("=== Scheduled Job: Recompute Categorization Accuracy ===");
        accuracyService.recomputeAccuracy().subscribe(
                summary -> { },
                e -> log.error("Error recomputing categorization accuracy", e));
    }

    /** Daily at 04:00. Running syncs are never deleted. */
    @Scheduled(cron = "${sync.retention-cron:0 0 4 * * *}")
    public void purgeOldRuns() {
        log.info("=== Scheduled Job: Purge Old Sync Runs ===");
        OffsetDateTime cutoff = OffsetDateTime.now(clock).minusDays(props.getRunRetentionDays());
        syncRunRepository.deleteFinishedBefore(cutoff).subscribe(
                deleted -> log.info("Deleted {} sync runs finished before {}", deleted, cutoff),
                e -> log.error("Error purging sync runs", e));
    }
}
