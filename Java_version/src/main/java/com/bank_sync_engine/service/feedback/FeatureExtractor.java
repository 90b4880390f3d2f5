package com.bank_sync_engine.service.feedback;

import com.bank_sync_engine.model.CanonicalTransaction;

import java.math.BigDecimal;
import java.text.Normalizer;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/** Training features of a transaction, stored as JSON on each training example. */
public final class FeatureExtractor {

    private FeatureExtractor() {}

    public static Map<String, Object> extract(CanonicalTransaction t) {
        String description = t.getDescription() == null ? "" : t.getDescription();
        BigDecimal amount = t.absoluteAmount();
        OffsetDateTime occurredAt = t.getOccurredAt();

        Map<String, Object> features = new LinkedHashMap<>();
        features.put("description_length", description.length());
        features.put("description_words", description.isBlank() ? 0 : description.trim().split("\\s+").length);
        features.put("amount_range", amountRange(amount));
        features.put("amount_log", amount.signum() > 0 ? Math.log(amount.doubleValue()) : 0.0);
        features.put("is_income", t.isIncome());
        features.put("transaction_type", t.getTransactionType() != null ? t.getTransactionType().wireValue() : null);
        features.put("has_counterpart", t.getCounterpartName() != null && !t.getCounterpartName().isBlank());
        if (occurredAt != null) {
            features.put("transaction_day", occurredAt.getDayOfMonth());
            // Monday = 0
            features.put("transaction_weekday", occurredAt.getDayOfWeek().getValue() - 1);
        }
        return features;
    }

    public static String amountRange(BigDecimal absoluteAmount) {
        if (absoluteAmount.compareTo(BigDecimal.valueOf(50)) < 0) {
            return "very_low";
        }
        if (absoluteAmount.compareTo(BigDecimal.valueOf(200)) < 0) {
            return "low";
        }
        if (absoluteAmount.compareTo(BigDecimal.valueOf(500)) < 0) {
            return "medium";
        }
        if (absoluteAmount.compareTo(BigDecimal.valueOf(1000)) < 0) {
            return "high";
        }
        return "very_high";
    }

    /**
     * Lookup key for verified examples: lower case, accents stripped, digits dropped, whitespace
     * collapsed. "PIX recebido 12/03 - Cliente ÁBC" and "pix recebido 14/03 - cliente abc" share a key.
     */
    public static String normalizeDescription(String description) {
        if (description == null) {
            return "";
        }
        String stripped = Normalizer.normalize(description, Normalizer.Form.NFD)
                .replaceAll("\\p{M}", "")
                .toLowerCase(Locale.ROOT)
                .replaceAll("[0-9]", " ")
                .replaceAll("[^a-z ]", " ")
                .replaceAll("\\s+", " ")
                .trim();
        return stripped.length() <= 500 ? stripped : stripped.substring(0, 500);
    }
}
