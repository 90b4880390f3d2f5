package com.bank_sync_engine.service.categorization;

import com.bank_sync_engine.config.SyncProperties;
import com.bank_sync_engine.event.TransactionEventPublisher;
import com.bank_sync_engine.event.TransactionUpsertedEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

/**
 * Categorizes transactions as sync batches commit, skipping rows that already carry a category.
 * Failures are logged and left to the uncategorized sweep.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CategorizationEventConsumer {

    private final TransactionEventPublisher publisher;
    private final CategorizationPipeline pipeline;
    private final SyncProperties syncProperties;

    private Disposable subscription;

    @PostConstruct
    public void start() {
        subscription = publisher.transactionEvents()
                .filter(CategorizationEventConsumer::needsCategory)
                .flatMap(event -> pipeline.categorize(event.transactionId())
                        .onErrorResume(e -> {
                            log.warn("Categorization of transaction {} failed, left for the sweep: {}",
                                    event.transactionId(), e.getMessage());
                            return Mono.empty();
                        }), syncProperties.getWorkerConcurrency())
                .subscribe();
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.dispose();
        }
    }

    // new rows are never categorized yet; updated rows keep their category
    static boolean needsCategory(TransactionUpsertedEvent event) {
        return !event.categorized();
    }
}
