package com.bank_sync_engine.scheduler;

import com.bank_sync_engine.config.SyncProperties;
import com.bank_sync_engine.exception.AuthException;
import com.bank_sync_engine.exception.ProviderUnavailableException;
import com.bank_sync_engine.exception.SyncAlreadyRunningException;
import com.bank_sync_engine.model.BankConnection;
import com.bank_sync_engine.model.SyncRun;
import com.bank_sync_engine.model.SyncStatus;
import com.bank_sync_engine.repository.BankConnectionRepository;
import com.bank_sync_engine.repository.SyncRunRepository;
import com.bank_sync_engine.service.categorization.BulkCategorizationService;
import com.bank_sync_engine.service.feedback.CategorizationAccuracyService;
import com.bank_sync_engine.service.sync.SyncOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SyncScheduler")
class SyncSchedulerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-15T12:00:00Z"), ZoneOffset.UTC);

    @Mock
    private BankConnectionRepository connectionRepository;
    @Mock
    private SyncRunRepository syncRunRepository;
    @Mock
    private SyncOrchestrator syncOrchestrator;
    @Mock
    private BulkCategorizationService bulkCategorizationService;
    @Mock
    private CategorizationAccuracyService accuracyService;

    private SyncProperties props;
    private SyncScheduler scheduler;

    @BeforeEach
    void setUp() {
        props = new SyncProperties();
        props.getRetry().setMaxAttempts(2);
        props.getRetry().setMinBackoff(Duration.ofMillis(1));
        props.getRetry().setMaxBackoff(Duration.ofMillis(1));
        scheduler = new SyncScheduler(connectionRepository, syncRunRepository, syncOrchestrator,
                new SyncRetryPolicy(props), bulkCategorizationService, accuracyService, props, CLOCK);
    }

    private static BankConnection connection() {
        return BankConnection.builder().id(UUID.randomUUID()).build();
    }

    private static SyncRun run(SyncStatus status) {
        return SyncRun.builder().id(UUID.randomUUID()).status(status).build();
    }

    @Test
    @DisplayName("Should count outcomes of every due connection")
    void shouldTallyOutcomes() {
        // Given
        BankConnection completed = connection();
        BankConnection partial = connection();
        BankConnection busy = connection();
        BankConnection unauthorized = connection();
        BankConnection flaky = connection();
        when(connectionRepository.findDueForSync(eq("ACTIVE"), any(OffsetDateTime.class), eq(4)))
                .thenReturn(Flux.just(completed, partial, busy, unauthorized, flaky));
        when(syncOrchestrator.syncConnection(completed.getId())).thenReturn(Mono.just(run(SyncStatus.COMPLETED)));
        when(syncOrchestrator.syncConnection(partial.getId())).thenReturn(Mono.just(run(SyncStatus.PARTIAL)));
        when(syncOrchestrator.syncConnection(busy.getId()))
                .thenReturn(Mono.error(new SyncAlreadyRunningException(busy.getId())));
        when(syncOrchestrator.syncConnection(unauthorized.getId()))
                .thenReturn(Mono.error(new AuthException("consent revoked")));
        AtomicInteger flakyAttempts = new AtomicInteger();
        when(syncOrchestrator.syncConnection(flaky.getId())).thenReturn(Mono.defer(() ->
                flakyAttempts.incrementAndGet() == 1
                        ? Mono.error(new ProviderUnavailableException("503", null))
                        : Mono.just(run(SyncStatus.COMPLETED))));

        // When / Then
        StepVerifier.create(scheduler.runDueSyncs())
                .assertNext(outcomes -> assertThat(outcomes)
                        .containsEntry("completed", 2L)
                        .containsEntry("partial", 1L)
                        .containsEntry(SyncScheduler.SKIPPED, 1L)
                        .containsEntry(SyncScheduler.FAILED, 1L)
                        .hasSize(4))
                .verifyComplete();
        assertThat(flakyAttempts.get()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should purge runs older than the retention window")
    void shouldPurgeOldRuns() {
        when(syncRunRepository.deleteFinishedBefore(any(OffsetDateTime.class))).thenReturn(Mono.just(7));

        scheduler.purgeOldRuns();

        verify(syncRunRepository).deleteFinishedBefore(OffsetDateTime.parse("2024-02-14T12:00:00Z"));
    }
}
