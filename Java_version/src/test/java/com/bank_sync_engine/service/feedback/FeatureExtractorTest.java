package com.bank_sync_engine.service.feedback;

import com.bank_sync_engine.model.CanonicalTransaction;
import com.bank_sync_engine.model.TransactionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FeatureExtractor")
class FeatureExtractorTest {

    @Test
    @DisplayName("Should extract description, amount and calendar features")
    void shouldExtractFeatures() {
        CanonicalTransaction t = CanonicalTransaction.builder()
                .description("Pagamento fornecedor XYZ")
                .amount(-25050L)
                .transactionType(TransactionType.DEBIT)
                .counterpartName("XYZ Ltda")
                // a Friday
                .occurredAt(OffsetDateTime.of(2024, 3, 15, 10, 0, 0, 0, ZoneOffset.UTC))
                .build();

        Map<String, Object> features = FeatureExtractor.extract(t);

        assertThat(features)
                .containsEntry("description_length", 24)
                .containsEntry("description_words", 3)
                .containsEntry("amount_range", "medium")
                .containsEntry("is_income", false)
                .containsEntry("transaction_type", "debit")
                .containsEntry("has_counterpart", true)
                .containsEntry("transaction_day", 15)
                .containsEntry("transaction_weekday", 4);
        assertThat((Double) features.get("amount_log")).isEqualTo(Math.log(250.50));
    }

    @Test
    @DisplayName("Should bucket amounts with lower bounds inclusive")
    void shouldBucketAmounts() {
        assertThat(FeatureExtractor.amountRange(new BigDecimal("49.99"))).isEqualTo("very_low");
        assertThat(FeatureExtractor.amountRange(new BigDecimal("50"))).isEqualTo("low");
        assertThat(FeatureExtractor.amountRange(new BigDecimal("200"))).isEqualTo("medium");
        assertThat(FeatureExtractor.amountRange(new BigDecimal("999.99"))).isEqualTo("high");
        assertThat(FeatureExtractor.amountRange(new BigDecimal("1000"))).isEqualTo("very_high");
    }

    @Test
    @DisplayName("Should give descriptions that differ only in digits, case and accents the same key")
    void shouldNormalizeDescriptions() {
        assertThat(FeatureExtractor.normalizeDescription("PIX recebido 12/03 - Cliente ÁBC"))
                .isEqualTo(FeatureExtractor.normalizeDescription("pix recebido 14/03 - cliente abc"))
                .isEqualTo("pix recebido cliente abc");
        assertThat(FeatureExtractor.normalizeDescription(null)).isEmpty();
    }
}
