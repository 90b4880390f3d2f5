package com.bank_sync_engine.scheduler;

import com.bank_sync_engine.config.SyncProperties;
import com.bank_sync_engine.exception.BankSyncException;
import com.bank_sync_engine.exception.RateLimitedException;
import com.bank_sync_engine.exception.SyncAlreadyRunningException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Retry decisions for scheduled syncs. Only retryable {@link BankSyncException}s are retried, with
 * exponential backoff between {@code sync.retry.min-backoff} and {@code sync.retry.max-backoff}. A
 * provider's Retry-After wins over the computed delay.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SyncRetryPolicy {

    private final SyncProperties props;

    public Retry retrySpec() {
        int maxAttempts = props.getRetry().getMaxAttempts();
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            long retry = signal.totalRetries() + 1;
            if (!isRetryable(failure) || retry >= maxAttempts) {
                return Mono.error(failure);
            }
            Duration delay = delayFor(failure, retry);
            log.warn("Sync attempt {} failed ({}), retrying in {}", retry, failure.getMessage(), delay);
            return Mono.delay(delay).thenReturn(retry);
        }));
    }

    public boolean isRetryable(Throwable failure) {
        if (failure instanceof SyncAlreadyRunningException) {
            return false;
        }
        return failure instanceof BankSyncException bse && bse.isRetryable();
    }

    /** Delay before retry number {@code retry} (1-based). */
    Duration delayFor(Throwable failure, long retry) {
        if (failure instanceof RateLimitedException rle && rle.getRetryAfter() != null) {
            return rle.getRetryAfter();
        }
        Duration min = props.getRetry().getMinBackoff();
        Duration max = props.getRetry().getMaxBackoff();
        long shift = Math.min(retry - 1, 30);
        Duration computed = min.multipliedBy(1L << shift);
        return computed.compareTo(max) > 0 ? max : computed;
    }
}
