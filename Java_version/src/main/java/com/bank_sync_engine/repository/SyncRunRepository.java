package com.bank_sync_engine.repository;

import com.bank_sync_engine.model.SyncRun;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.UUID;

public interface SyncRunRepository extends ReactiveCrudRepository<SyncRun, UUID>, SyncRunFinalizer {

    Flux<SyncRun> findTop20ByConnectionIdOrderByStartedAtDesc(UUID connectionId);

    @Modifying
    @Query("DELETE FROM sync_runs WHERE started_at < :cutoff AND status <> 'RUNNING'")
    Mono<Integer> deleteFinishedBefore(OffsetDateTime cutoff);
}
