package com.bank_sync_engine.service.categorization;

import com.bank_sync_engine.config.CategorizationProperties;
import com.bank_sync_engine.dto.BulkCategorizationResult;
import com.bank_sync_engine.dto.CategorizationResult;
import com.bank_sync_engine.dto.RuleApplicationResult;
import com.bank_sync_engine.exception.ResourceNotFoundException;
import com.bank_sync_engine.model.CanonicalTransaction;
import com.bank_sync_engine.model.CategorizationDecision;
import com.bank_sync_engine.model.CategorizationMethod;
import com.bank_sync_engine.model.CategoryRule;
import com.bank_sync_engine.repository.CategorizationDecisionRepository;
import com.bank_sync_engine.repository.CategoryRuleRepository;
import com.bank_sync_engine.repository.TransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Batch entry points into the pipeline. Transactions are processed one after another; a failure on
 * one is counted and does not stop the batch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BulkCategorizationService {

    private final TransactionRepository transactionRepository;
    private final CategoryRuleRepository ruleRepository;
    private final CategorizationDecisionRepository decisionRepository;
    private final CategorizationPipeline pipeline;
    private final RuleMatcher ruleMatcher;
    private final TransactionalOperator transactionalOperator;
    private final CategorizationProperties props;
    private final Clock clock;

    public Mono<BulkCategorizationResult> categorizeUncategorized(UUID companyId, int limit) {
        return run(transactionRepository.findUncategorized(companyId, limit));
    }

    /** All companies; driven by the scheduler to catch rows whose upsert event was dropped. */
    public Mono<BulkCategorizationResult> sweepUncategorized() {
        return run(transactionRepository.findAllUncategorized(props.getSweepLimit()));
    }

    private Mono<BulkCategorizationResult> run(Flux<CanonicalTransaction> transactions) {
        return transactions
                .concatMap(t -> pipeline.categorize(t)
                        .map(Optional::of)
                        .onErrorResume(e -> {
                            log.warn("Bulk categorization of transaction {} failed: {}", t.getId(), e.getMessage());
                            return Mono.just(Optional.empty());
                        }))
                .collectList()
                .map(BulkCategorizationService::tally);
    }

    /**
     * Re-runs the pipeline on AI results below {@code threshold}. Every attempt is logged; the
     * transaction only changes when the new confidence is higher.
     */
    public Mono<BulkCategorizationResult> recategorizeLowConfidence(UUID companyId, double threshold, int limit) {
        return transactionRepository.findLowConfidence(companyId, threshold, limit)
                .concatMap(t -> pipeline.evaluate(t)
                        .flatMap(evaluation -> {
                            CategorizationResult result = evaluation.result();
                            double previous = t.getCategoryConfidence() != null ? t.getCategoryConfidence() : 0.0;
                            Mono<Optional<CategorizationResult>> apply = result.confidence() > previous
                                    ? transactionRepository.applyCategorization(t.getId(), result.categoryId(),
                                            result.confidence(), OffsetDateTime.now(clock))
                                            .thenReturn(Optional.of(result))
                                    : Mono.just(Optional.empty());
                            return decisionRepository.save(evaluation.decision())
                                    .then(apply)
                                    .as(transactionalOperator::transactional);
                        })
                        .map(improved -> new Attempt(improved, false))
                        .onErrorResume(e -> {
                            log.warn("Recategorization of transaction {} failed: {}", t.getId(), e.getMessage());
                            return Mono.just(new Attempt(Optional.empty(), true));
                        }))
                .collectList()
                .map(attempts -> {
                    List<Optional<CategorizationResult>> improved = attempts.stream()
                            .filter(a -> !a.failed())
                            .map(Attempt::result)
                            .toList();
                    BulkCategorizationResult tally = tally(improved);
                    int errors = (int) attempts.stream().filter(Attempt::failed).count();
                    return tally.toBuilder().processed(attempts.size()).errors(errors).build();
                });
    }

    private record Attempt(Optional<CategorizationResult> result, boolean failed) {}

    /**
     * Applies one rule to the company's most recent transactions. Only uncategorized, unreviewed rows
     * are changed; every match counts towards the rule's match count.
     */
    public Mono<RuleApplicationResult> applyRule(UUID companyId, UUID ruleId, int limit) {
        return ruleRepository.findById(ruleId)
                .filter(rule -> companyId.equals(rule.getCompanyId()))
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Rule", ruleId)))
                .flatMap(rule -> transactionRepository.findRecentByCompany(companyId, limit)
                        .collectList()
                        .flatMap(transactions -> {
                            List<CanonicalTransaction> matches = transactions.stream()
                                    .filter(t -> ruleMatcher.matches(rule, t))
                                    .toList();
                            return Flux.fromIterable(matches)
                                    .filter(t -> t.getCategoryId() == null && !Boolean.TRUE.equals(t.getManuallyReviewed()))
                                    .concatMap(t -> applyRuleTo(rule, t))
                                    .count()
                                    .flatMap(applied -> ruleRepository.incrementMatchCount(rule.getId(), matches.size())
                                            .thenReturn(new RuleApplicationResult(rule.getId(), transactions.size(),
                                                    matches.size(), applied.intValue())));
                        }))
                .doOnNext(r -> log.info("Rule {} applied: examined={} matched={} applied={}",
                        r.ruleId(), r.examined(), r.matched(), r.applied()));
    }

    private Mono<Integer> applyRuleTo(CategoryRule rule, CanonicalTransaction t) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        double confidence = rule.getConfidenceThreshold() != null
                ? rule.getConfidenceThreshold() : CategorizationPipeline.DEFAULT_RULE_CONFIDENCE;
        CategorizationDecision decision = CategorizationDecision.builder()
                .transactionId(t.getId())
                .companyId(t.getCompanyId())
                .method(CategorizationMethod.RULE)
                .suggestedCategoryId(rule.getCategoryId())
                .confidence(confidence)
                .ruleId(rule.getId())
                .reason("rule '" + rule.getName() + "' applied in bulk")
                .processingTimeMs(0L)
                .wasAccepted(true)
                .finalCategoryId(rule.getCategoryId())
                .createdAt(now)
                .build();
        return decisionRepository.save(decision)
                .then(transactionRepository.applyCategorization(t.getId(), rule.getCategoryId(), confidence, now))
                .as(transactionalOperator::transactional);
    }

    private static BulkCategorizationResult tally(List<Optional<CategorizationResult>> results) {
        int byRule = 0;
        int byClassifier = 0;
        int byDefault = 0;
        int errors = 0;
        for (Optional<CategorizationResult> r : results) {
            if (r.isEmpty()) {
                errors++;
                continue;
            }
            switch (r.get().method()) {
                case RULE -> byRule++;
                case CLASSIFIER -> byClassifier++;
                default -> byDefault++;
            }
        }
        return BulkCategorizationResult.builder()
                .processed(results.size())
                .categorized(byRule + byClassifier + byDefault)
                .byRule(byRule)
                .byClassifier(byClassifier)
                .byDefault(byDefault)
                .errors(errors)
                .build();
    }
}
