package com.bank_sync_engine.openbanking;

import com.bank_sync_engine.model.TransactionType;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * One provider transaction after type mapping but before normalization. {@code amount} is signed,
 * in major units, and is null when the provider value could not be parsed.
 */
public record RawTransaction(
        String externalId,
        TransactionType type,
        BigDecimal amount,
        String currency,
        OffsetDateTime bookedAt,
        String description,
        String counterpartName,
        String counterpartDocument,
        String referenceNumber,
        BigDecimal balanceAfter,
        String status
) {}
