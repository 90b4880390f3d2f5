package com.bank_sync_engine.service.feedback;

import com.bank_sync_engine.dto.AccuracyReport;
import com.bank_sync_engine.model.CategorizationDecision;
import com.bank_sync_engine.model.CategorizationMethod;
import com.bank_sync_engine.repository.CategorizationDecisionRepository;
import com.bank_sync_engine.repository.CategorizationDecisionRepository.ReviewAggregate;
import com.bank_sync_engine.repository.CategoryRepository;
import com.bank_sync_engine.repository.CategoryRuleRepository;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.UUID;
import java.util.function.BiFunction;

/**
 * Accuracy is accepted / reviewed over the decisions that carry a review outcome. Decisions nobody
 * looked at are left out of the ratio.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CategorizationAccuracyService {

    private final CategorizationDecisionRepository decisionRepository;
    private final CategoryRuleRepository ruleRepository;
    private final CategoryRepository categoryRepository;

    public record RecomputeSummary(@JsonProperty("rules_updated") int rulesUpdated,
                                   @JsonProperty("categories_updated") int categoriesUpdated) {}

    /** Recomputes every rule and category accuracy from scratch, so running it twice changes nothing. */
    public Mono<RecomputeSummary> recomputeAccuracy() {
        Mono<Integer> rules = apply(decisionRepository.aggregateByRule(), ruleRepository::updateAccuracy);
        Mono<Integer> categories = apply(decisionRepository.aggregateByCategory(), categoryRepository::updateAccuracy);
        return Mono.zip(rules, categories)
                .map(t -> new RecomputeSummary(t.getT1(), t.getT2()))
                .doOnNext(s -> log.info("Accuracy recomputed for {} rules and {} categories",
                        s.rulesUpdated(), s.categoriesUpdated()));
    }

    private static Mono<Integer> apply(Flux<ReviewAggregate> aggregates,
                                       BiFunction<UUID, Double, Mono<Integer>> update) {
        return aggregates
                .filter(a -> a.reviewed() != null && a.reviewed() > 0)
                .concatMap(a -> update.apply(a.keyId(), ratio(a.accepted(), a.reviewed())))
                .count()
                .map(Long::intValue);
    }

    public Mono<AccuracyReport> report(UUID companyId, OffsetDateTime from, OffsetDateTime to) {
        return decisionRepository.findByCompanyIdAndCreatedAtBetween(companyId, from, to)
                .collectList()
                .map(decisions -> {
                    Map<CategorizationMethod, AccuracyReport.MethodStats> byMethod = new EnumMap<>(CategorizationMethod.class);
                    for (CategorizationMethod method : CategorizationMethod.values()) {
                        List<CategorizationDecision> ofMethod = decisions.stream()
                                .filter(d -> d.getMethod() == method)
                                .toList();
                        if (!ofMethod.isEmpty()) {
                            byMethod.put(method, stats(ofMethod));
                        }
                    }
                    AccuracyReport.MethodStats overall = stats(decisions);
                    return AccuracyReport.builder()
                            .periodStart(from)
                            .periodEnd(to)
                            .totalDecisions(overall.total())
                            .reviewedDecisions(overall.reviewed())
                            .acceptedDecisions(overall.accepted())
                            .overallAccuracy(overall.accuracy())
                            .byMethod(byMethod)
                            .build();
                });
    }

    private static AccuracyReport.MethodStats stats(List<CategorizationDecision> decisions) {
        long reviewed = decisions.stream().filter(d -> d.getWasAccepted() != null).count();
        long accepted = decisions.stream().filter(d -> Boolean.TRUE.equals(d.getWasAccepted())).count();
        OptionalDouble averageConfidence = decisions.stream()
                .map(CategorizationDecision::getConfidence)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average();
        return AccuracyReport.MethodStats.builder()
                .total(decisions.size())
                .reviewed(reviewed)
                .accepted(accepted)
                .accuracy(reviewed > 0 ? ratio(accepted, reviewed) : null)
                .averageConfidence(averageConfidence.isPresent() ? averageConfidence.getAsDouble() : null)
                .build();
    }

    static double ratio(Long accepted, Long reviewed) {
        return (accepted == null ? 0L : accepted) / (double) reviewed;
    }
}
