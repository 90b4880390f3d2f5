package com.bank_sync_engine.openbanking;

import com.bank_sync_engine.model.CanonicalTransaction;
import com.bank_sync_engine.openbanking.dto.ObAmount;
import com.bank_sync_engine.openbanking.dto.ObTransaction;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Provider transaction payload to {@link RawTransaction}. Unparsable values become null so the
 * normalizer can skip the row instead of failing the whole page.
 */
@Slf4j
public final class ProviderTransactionMapper {

    private ProviderTransactionMapper() {}

    public static RawTransaction toRaw(ObTransaction t) {
        BigDecimal magnitude = parseAmount(t.amount());
        boolean credit = isCredit(t.creditDebitType(), magnitude);
        BigDecimal signed = magnitude == null ? null : (credit ? magnitude.abs() : magnitude.abs().negate());
        String code = t.type() != null ? t.type() : t.proprietaryBankTransactionCode();

        return new RawTransaction(
                t.transactionId(),
                TransactionTypeMapper.map(code, credit),
                signed,
                t.amount() != null ? t.amount().currency() : null,
                parseTimestamp(t.bookingDateTime()),
                t.transactionName() != null ? t.transactionName() : t.remittanceInformation(),
                credit ? t.debtorName() : t.creditorName(),
                t.partieDocument(),
                t.proprietaryBankTransactionCode(),
                parseAmount(t.balanceAfterTransaction()),
                status(t.completedAuthorisedPaymentType())
        );
    }

    // Open Finance Brasil: TRANSACAO_EFETIVADA is booked, LANCAMENTO_FUTURO is scheduled
    private static String status(String paymentType) {
        if (paymentType == null || "TRANSACAO_EFETIVADA".equalsIgnoreCase(paymentType)) {
            return CanonicalTransaction.STATUS_COMPLETED;
        }
        return "LANCAMENTO_FUTURO".equalsIgnoreCase(paymentType) ? "pending" : paymentType.toLowerCase(Locale.ROOT);
    }

    private static boolean isCredit(String creditDebitType, BigDecimal amount) {
        if (creditDebitType != null && !creditDebitType.isBlank()) {
            return "CREDIT".equalsIgnoreCase(creditDebitType.trim());
        }
        return amount != null && amount.signum() > 0;
    }

    static BigDecimal parseAmount(ObAmount amount) {
        if (amount == null || amount.amount() == null || amount.amount().isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(amount.amount().trim());
        } catch (NumberFormatException e) {
            log.warn("Unparsable provider amount '{}'", amount.amount());
            return null;
        }
    }

    // ISO offset date-time, or local date-time taken as UTC
    static OffsetDateTime parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value).atOffset(ZoneOffset.UTC);
            } catch (DateTimeParseException e2) {
                try {
                    return LocalDate.parse(value).atStartOfDay().atOffset(ZoneOffset.UTC);
                } catch (DateTimeParseException e3) {
                    log.warn("Unparsable provider timestamp '{}'", value);
                    return null;
                }
            }
        }
    }
}
