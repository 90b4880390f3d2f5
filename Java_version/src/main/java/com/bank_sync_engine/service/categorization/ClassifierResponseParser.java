package com.bank_sync_engine.service.categorization;

import java.util.Locale;

/**
 * Reads the line-oriented classifier reply:
 * <pre>
 * CATEGORY: Vendas
 * CONFIDENCE: 0.85
 * REASON: recurring customer payment
 * </pre>
 */
public final class ClassifierResponseParser {

    private ClassifierResponseParser() {}

    /** Null when the reply names no category. */
    public static ClassifierVerdict parse(String reply) {
        if (reply == null) {
            return null;
        }
        String category = null;
        Double confidence = null;
        String reason = null;
        for (String rawLine : reply.split("\\R")) {
            String line = rawLine.trim();
            String upper = line.toUpperCase(Locale.ROOT);
            if (upper.startsWith("CATEGORY:")) {
                category = value(line);
            } else if (upper.startsWith("CONFIDENCE:")) {
                confidence = parseConfidence(value(line));
            } else if (upper.startsWith("REASON:")) {
                reason = value(line);
            }
        }
        if (category == null || category.isBlank()) {
            return null;
        }
        return new ClassifierVerdict(category, confidence, reason);
    }

    private static String value(String line) {
        return line.substring(line.indexOf(':') + 1).trim();
    }

    // accepts "0.85", "0,85" and "85%"
    static Double parseConfidence(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.replace(',', '.').trim();
        boolean percent = v.endsWith("%");
        if (percent) {
            v = v.substring(0, v.length() - 1).trim();
        }
        try {
            double parsed = Double.parseDouble(v);
            if (percent) {
                parsed = parsed / 100.0;
            }
            return Double.isFinite(parsed) ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
