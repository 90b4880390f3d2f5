package com.bank_sync_engine.openbanking;

import com.bank_sync_engine.exception.AuthException;
import com.bank_sync_engine.exception.BankSyncException;
import com.bank_sync_engine.exception.InvalidGrantException;
import com.bank_sync_engine.exception.ProviderUnavailableException;
import com.bank_sync_engine.exception.RateLimitedException;
import io.netty.handler.timeout.ReadTimeoutException;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Maps WebClient failures onto the error taxonomy. Applied at the connector and gateway boundary
 * with {@code onErrorMap}, so nothing above those layers sees a transport exception.
 */
public final class ProviderErrorTranslator {

    private ProviderErrorTranslator() {}

    /** Errors from account and transaction endpoints. */
    public static Throwable translate(Throwable error, String operation) {
        if (error instanceof BankSyncException) {
            return error;
        }
        if (error instanceof WebClientResponseException ex) {
            int status = ex.getStatusCode().value();
            if (status == 401 || status == 403) {
                return new AuthException(operation + " rejected with HTTP " + status, ex);
            }
            if (status == 429) {
                return new RateLimitedException(operation + " throttled by provider", retryAfter(ex), ex);
            }
            if (status >= 500) {
                return new ProviderUnavailableException(operation + " failed with HTTP " + status, ex);
            }
            return new ProviderUnavailableException(operation + " failed with HTTP " + status, false, ex);
        }
        if (error instanceof WebClientRequestException
                || error instanceof TimeoutException
                || error instanceof ReadTimeoutException) {
            return new ProviderUnavailableException(operation + " failed: " + error.getMessage(), error);
        }
        return new ProviderUnavailableException(operation + " failed unexpectedly: " + error.getMessage(), false, error);
    }

    /**
     * Errors from the token endpoint. A 400 or 401 carrying {@code invalid_grant} means the code or
     * refresh token is unusable and must not be retried.
     */
    public static Throwable translateTokenError(Throwable error, String operation) {
        if (error instanceof WebClientResponseException ex) {
            int status = ex.getStatusCode().value();
            String body = ex.getResponseBodyAsString();
            if ((status == 400 || status == 401) && body != null && body.contains("invalid_grant")) {
                return new InvalidGrantException(operation + " rejected: invalid_grant", ex);
            }
            if (status == 400) {
                return new InvalidGrantException(operation + " rejected with HTTP 400", ex);
            }
        }
        return translate(error, operation);
    }

    // Retry-After in delta-seconds; HTTP-date values are ignored
    static Duration retryAfter(WebClientResponseException ex) {
        String value = ex.getHeaders().getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null) {
            return null;
        }
        try {
            long seconds = Long.parseLong(value.trim());
            return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
