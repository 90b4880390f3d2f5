package com.bank_sync_engine.service.categorization;

import com.bank_sync_engine.repository.TrainingExampleRepository;
import com.bank_sync_engine.service.feedback.FeatureExtractor;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Deterministic classifier: a verified training example with the same normalized description wins
 * outright; otherwise categories score by how many of their keyword hints occur in the description
 * or counterpart name.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "categorization", name = "classifier", havingValue = "keyword", matchIfMissing = true)
public class KeywordHintClassifier implements TransactionClassifier {

    static final double EXAMPLE_CONFIDENCE = 0.95;
    static final double FIRST_HIT = 0.6;
    static final double EXTRA_HIT = 0.1;
    static final double MAX_HINT_CONFIDENCE = 0.9;

    private final TrainingExampleRepository trainingExampleRepository;

    @Override
    public Mono<ClassifierVerdict> classify(ClassificationRequest request) {
        String normalized = FeatureExtractor.normalizeDescription(request.description());
        Mono<ClassifierVerdict> fromExample = normalized.isEmpty()
                ? Mono.empty()
                : trainingExampleRepository
                        .findFirstByCompanyIdAndNormalizedDescriptionAndVerifiedTrueOrderByCreatedAtDesc(
                                request.companyId(), normalized)
                        .flatMap(example -> Mono.justOrEmpty(request.candidates().stream()
                                .filter(c -> c.id().equals(example.getCategoryId()))
                                .findFirst()))
                        .map(c -> new ClassifierVerdict(c.name(), EXAMPLE_CONFIDENCE,
                                "same description as a verified example"));

        return fromExample.switchIfEmpty(Mono.defer(() -> Mono.justOrEmpty(byKeywordHints(request))));
    }

    @Override
    public String name() {
        return "keyword-hints";
    }

    static Optional<ClassifierVerdict> byKeywordHints(ClassificationRequest request) {
        String text = ((request.description() == null ? "" : request.description()) + " "
                + (request.counterpartName() == null ? "" : request.counterpartName())).toLowerCase(Locale.ROOT);

        record Scored(CandidateCategory category, int hits) {}

        return request.candidates().stream()
                .map(c -> new Scored(c, hits(text, c.keywords())))
                .filter(s -> s.hits() > 0)
                .min(Comparator.comparingInt((Scored s) -> -s.hits())
                        .thenComparing(s -> s.category().name()))
                .map(s -> new ClassifierVerdict(
                        s.category().name(),
                        Math.min(MAX_HINT_CONFIDENCE, FIRST_HIT + EXTRA_HIT * (s.hits() - 1)),
                        s.hits() + " keyword hint(s) matched"));
    }

    private static int hits(String text, List<String> keywords) {
        if (keywords == null) {
            return 0;
        }
        return (int) keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .filter(k -> text.contains(k.toLowerCase(Locale.ROOT)))
                .count();
    }
}
