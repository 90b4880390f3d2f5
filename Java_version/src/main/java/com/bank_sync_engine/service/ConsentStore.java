package com.bank_sync_engine.service;

import com.bank_sync_engine.exception.InvalidGrantException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers which company started which consent, keyed by the OAuth {@code state}. A state can be
 * redeemed once.
 */
@Slf4j
@Component
public class ConsentStore {

    public record PendingConsent(UUID companyId, String providerCode, String consentId, Instant expiresAt) {}

    private final Map<String, PendingConsent> byState = new ConcurrentHashMap<>();
    private final Clock clock;

    public ConsentStore(Clock clock) {
        this.clock = clock;
    }

    public void register(String state, PendingConsent consent) {
        byState.put(state, consent);
    }

    /** Removes and returns the consent for {@code state}; unknown or expired states are invalid grants. */
    public PendingConsent redeem(String state) {
        PendingConsent consent = state == null ? null : byState.remove(state);
        if (consent == null) {
            throw new InvalidGrantException("Unknown or already used consent state");
        }
        if (clock.instant().isAfter(consent.expiresAt())) {
            throw new InvalidGrantException("Consent " + consent.consentId() + " expired");
        }
        return consent;
    }

    @Scheduled(fixedDelay = 15 * 60 * 1000L)
    public void purgeExpired() {
        Instant now = clock.instant();
        int before = byState.size();
        byState.values().removeIf(c -> now.isAfter(c.expiresAt()));
        int purged = before - byState.size();
        if (purged > 0) {
            log.info("Purged {} expired consents", purged);
        }
    }
}
