package com.bank_sync_engine.event;

import com.bank_sync_engine.config.SyncProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded in-process channel between the sync orchestrator and its consumers (categorization,
 * notifiers). Publishing never blocks: when the buffer is full the event is dropped and counted.
 * A dropped transaction event is harmless because the uncategorized sweep picks the row up later.
 */
@Slf4j
@Component
public class TransactionEventPublisher {

    private final Sinks.Many<SyncEvent> sink;
    private final AtomicLong dropped = new AtomicLong();

    public TransactionEventPublisher(SyncProperties props) {
        this.sink = Sinks.many().multicast().onBackpressureBuffer(props.getEventBufferSize(), false);
    }

    /** Returns false when the event was dropped. */
    public synchronized boolean publish(SyncEvent event) {
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isSuccess()) {
            return true;
        }
        long total = dropped.incrementAndGet();
        log.warn("Dropped {} for connection {} ({}), {} dropped so far",
                event.getClass().getSimpleName(), event.connectionId(), result, total);
        return false;
    }

    public Flux<SyncEvent> events() {
        return sink.asFlux();
    }

    public Flux<TransactionUpsertedEvent> transactionEvents() {
        return events().ofType(TransactionUpsertedEvent.class);
    }

    public Flux<BalanceChangedEvent> balanceEvents() {
        return events().ofType(BalanceChangedEvent.class);
    }

    public long droppedCount() {
        return dropped.get();
    }
}
