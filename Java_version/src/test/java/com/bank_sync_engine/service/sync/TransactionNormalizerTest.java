package com.bank_sync_engine.service.sync;

import com.bank_sync_engine.exception.ValidationException;
import com.bank_sync_engine.model.BankConnection;
import com.bank_sync_engine.model.CanonicalTransaction;
import com.bank_sync_engine.model.TransactionType;
import com.bank_sync_engine.openbanking.RawTransaction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TransactionNormalizer")
class TransactionNormalizerTest {

    private static final OffsetDateTime BOOKED = OffsetDateTime.of(2024, 3, 15, 10, 0, 0, 0, ZoneOffset.UTC);

    private final BankConnection connection = BankConnection.builder()
            .id(UUID.randomUUID())
            .companyId(UUID.randomUUID())
            .currency("BRL")
            .build();

    private static RawTransaction raw(String externalId, BigDecimal amount, String description) {
        return new RawTransaction(externalId, TransactionType.PIX_IN, amount, null, BOOKED, description,
                "Cliente ABC", null, null, new BigDecimal("5000"), null);
    }

    @Test
    @DisplayName("Should convert major units to signed minor units")
    void shouldConvertAmounts() {
        CanonicalTransaction t = TransactionNormalizer.normalize(raw("tx-1", new BigDecimal("1000.00"), "PIX"), connection);

        assertThat(t.getAmount()).isEqualTo(100000L);
        assertThat(t.getBalanceAfter()).isEqualTo(500000L);
        assertThat(t.getCurrency()).isEqualTo("BRL");
        assertThat(t.getStatus()).isEqualTo(CanonicalTransaction.STATUS_COMPLETED);
        assertThat(t.getConnectionId()).isEqualTo(connection.getId());
        assertThat(t.getCompanyId()).isEqualTo(connection.getCompanyId());

        assertThat(TransactionNormalizer.toMinorUnits(new BigDecimal("-12.345"))).isEqualTo(-1235L);
        assertThat(TransactionNormalizer.toMinorUnits(new BigDecimal("0.005"))).isEqualTo(1L);
    }

    @Test
    @DisplayName("Should truncate long descriptions and fall back to the type for blank ones")
    void shouldShapeDescription() {
        CanonicalTransaction longOne = TransactionNormalizer.normalize(raw("tx-1", BigDecimal.TEN, "x".repeat(800)), connection);
        CanonicalTransaction blank = TransactionNormalizer.normalize(raw("tx-2", BigDecimal.TEN, "  "), connection);

        assertThat(longOne.getDescription()).hasSize(TransactionNormalizer.MAX_DESCRIPTION);
        assertThat(blank.getDescription()).isEqualTo("pix_in");
    }

    @Test
    @DisplayName("Should reject rows without identity, amount or booking date")
    void shouldRejectInvalidRows() {
        assertThatThrownBy(() -> TransactionNormalizer.normalize(raw(null, BigDecimal.TEN, "a"), connection))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> TransactionNormalizer.normalize(raw("x".repeat(101), BigDecimal.TEN, "a"), connection))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> TransactionNormalizer.normalize(raw("tx-1", null, "a"), connection))
                .isInstanceOf(ValidationException.class);

        RawTransaction undated = new RawTransaction("tx-1", TransactionType.DEBIT, BigDecimal.ONE, "BRL", null,
                "a", null, null, null, null, null);
        assertThatThrownBy(() -> TransactionNormalizer.normalize(undated, connection))
                .isInstanceOf(ValidationException.class);
    }
}
