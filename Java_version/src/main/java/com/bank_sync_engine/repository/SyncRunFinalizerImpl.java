package com.bank_sync_engine.repository;

import com.bank_sync_engine.model.SyncRun;
import com.bank_sync_engine.model.SyncStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.relational.core.query.Update;
import reactor.core.publisher.Mono;

import static org.springframework.data.relational.core.query.Criteria.where;
import static org.springframework.data.relational.core.query.Query.query;

@RequiredArgsConstructor
class SyncRunFinalizerImpl implements SyncRunFinalizer {

    private final R2dbcEntityTemplate template;

    @Override
    public Mono<Long> finalizeRun(SyncRun run) {
        Update update = Update.update("status", run.getStatus())
                .set("transactionsFound", run.getTransactionsFound())
                .set("transactionsNew", run.getTransactionsNew())
                .set("transactionsUpdated", run.getTransactionsUpdated())
                .set("transactionsSkipped", run.getTransactionsSkipped())
                .set("errorCode", run.getErrorCode())
                .set("errorMessage", run.getErrorMessage())
                .set("completedAt", run.getCompletedAt());
        return template.update(
                query(where("id").is(run.getId()).and("status").is(SyncStatus.RUNNING)),
                update, SyncRun.class);
    }
}
