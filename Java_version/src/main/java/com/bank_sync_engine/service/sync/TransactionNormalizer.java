package com.bank_sync_engine.service.sync;

import com.bank_sync_engine.exception.ValidationException;
import com.bank_sync_engine.model.BankConnection;
import com.bank_sync_engine.model.CanonicalTransaction;
import com.bank_sync_engine.openbanking.RawTransaction;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** {@link RawTransaction} to the canonical row shape. Invalid input raises {@link ValidationException}. */
public final class TransactionNormalizer {

    static final int MAX_DESCRIPTION = 500;
    static final int MAX_COUNTERPART = 200;
    static final int MAX_EXTERNAL_ID = 100;

    private TransactionNormalizer() {}

    public static CanonicalTransaction normalize(RawTransaction raw, BankConnection connection) {
        if (raw.externalId() == null || raw.externalId().isBlank()) {
            throw new ValidationException("Transaction without external id");
        }
        if (raw.externalId().length() > MAX_EXTERNAL_ID) {
            throw new ValidationException("External id too long: " + raw.externalId().length());
        }
        if (raw.amount() == null) {
            throw new ValidationException("Transaction " + raw.externalId() + " has no parsable amount");
        }
        if (raw.bookedAt() == null) {
            throw new ValidationException("Transaction " + raw.externalId() + " has no booking date");
        }

        String description = raw.description() == null || raw.description().isBlank()
                ? raw.type().wireValue()
                : raw.description().trim();

        return CanonicalTransaction.builder()
                .connectionId(connection.getId())
                .companyId(connection.getCompanyId())
                .externalId(raw.externalId())
                .transactionType(raw.type())
                .amount(toMinorUnits(raw.amount()))
                .currency(raw.currency() != null ? raw.currency() : connection.getCurrency())
                .description(truncate(description, MAX_DESCRIPTION))
                .occurredAt(raw.bookedAt())
                .counterpartName(truncate(raw.counterpartName(), MAX_COUNTERPART))
                .counterpartDocument(raw.counterpartDocument())
                .referenceNumber(raw.referenceNumber())
                .balanceAfter(raw.balanceAfter() != null ? toMinorUnits(raw.balanceAfter()) : null)
                .status(raw.status() != null ? raw.status() : CanonicalTransaction.STATUS_COMPLETED)
                .build();
    }

    static long toMinorUnits(BigDecimal majorUnits) {
        try {
            return majorUnits.setScale(2, RoundingMode.HALF_UP).movePointRight(2).longValueExact();
        } catch (ArithmeticException e) {
            throw new ValidationException("Amount out of range: " + majorUnits);
        }
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        return value.length() <= max ? value : value.substring(0, max);
    }
}
