package com.bank_sync_engine.service.categorization;

import reactor.core.publisher.Mono;

/**
 * Second pass of the categorization pipeline. Completes empty when it has no opinion; errors are
 * absorbed by the pipeline, which falls through to the default category.
 */
public interface TransactionClassifier {

    Mono<ClassifierVerdict> classify(ClassificationRequest request);

    /** Recorded on every decision this classifier produced. */
    String name();
}
