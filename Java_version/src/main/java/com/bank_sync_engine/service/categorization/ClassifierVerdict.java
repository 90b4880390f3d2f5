package com.bank_sync_engine.service.categorization;

/**
 * What a classifier answered. {@code confidence} is null when the answer carried no parsable
 * confidence; such verdicts are discarded.
 */
public record ClassifierVerdict(String categoryName, Double confidence, String reason) {}
