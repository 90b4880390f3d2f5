package com.bank_sync_engine.service.categorization;

import com.bank_sync_engine.config.CategorizationProperties;
import com.bank_sync_engine.dto.CategorizationResult;
import com.bank_sync_engine.exception.ResourceNotFoundException;
import com.bank_sync_engine.exception.ValidationException;
import com.bank_sync_engine.model.CanonicalTransaction;
import com.bank_sync_engine.model.CategorizationDecision;
import com.bank_sync_engine.model.CategorizationMethod;
import com.bank_sync_engine.model.Category;
import com.bank_sync_engine.model.CategoryRule;
import com.bank_sync_engine.repository.CategorizationDecisionRepository;
import com.bank_sync_engine.repository.CategoryRepository;
import com.bank_sync_engine.repository.CategoryRuleRepository;
import com.bank_sync_engine.repository.TransactionRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Rules, then the classifier, then the company's default bucket. Each attempt logs exactly one
 * {@link CategorizationDecision}, and every processed transaction ends up with a category.
 * <p>
 * A result is accepted when its confidence is at least {@code categorization.confidence-threshold};
 * a rule's confidence is its own {@code confidence_threshold}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CategorizationPipeline {

    static final String FALLBACK_REASON = "fallback";
    static final double DEFAULT_RULE_CONFIDENCE = 0.8;

    private final CategoryRuleRepository ruleRepository;
    private final CategoryRepository categoryRepository;
    private final CategorizationDecisionRepository decisionRepository;
    private final TransactionRepository transactionRepository;
    private final RuleMatcher ruleMatcher;
    private final TransactionClassifier classifier;
    private final TransactionalOperator transactionalOperator;
    private final CategorizationProperties props;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /** Outcome of the three passes plus the decision row describing it, not yet persisted. */
    public record Evaluation(CategorizationResult result, CategorizationDecision decision) {}

    public Mono<CategorizationResult> categorize(UUID transactionId) {
        return transactionRepository.findById(transactionId)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Transaction", transactionId)))
                .flatMap(this::categorize);
    }

    /** Evaluates, logs the decision and writes the category onto the transaction. */
    public Mono<CategorizationResult> categorize(CanonicalTransaction transaction) {
        if (Boolean.TRUE.equals(transaction.getManuallyReviewed())) {
            return Mono.error(new ValidationException(
                    "Transaction " + transaction.getId() + " was reviewed manually and is not recategorized"));
        }
        return evaluate(transaction)
                .flatMap(evaluation -> decisionRepository.save(evaluation.decision())
                        .then(transactionRepository.applyCategorization(transaction.getId(),
                                evaluation.result().categoryId(), evaluation.result().confidence(),
                                OffsetDateTime.now(clock)))
                        .as(transactionalOperator::transactional)
                        .thenReturn(evaluation.result()))
                .doOnNext(result -> log.debug("Transaction {} categorized by {} with confidence {}",
                        transaction.getId(), result.method().wireValue(), result.confidence()));
    }

    /** Runs the passes without touching the transaction row. Rule match counts are still updated. */
    public Mono<Evaluation> evaluate(CanonicalTransaction transaction) {
        long started = System.nanoTime();
        return rulePass(transaction)
                .switchIfEmpty(Mono.defer(() -> classifierPass(transaction)))
                .switchIfEmpty(Mono.defer(() -> defaultPass(transaction)))
                .map(result -> new Evaluation(result,
                        decisionFor(transaction, result, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started))));
    }

    private Mono<CategorizationResult> rulePass(CanonicalTransaction transaction) {
        return ruleRepository.findByCompanyIdAndActiveTrue(transaction.getCompanyId())
                .sort(CategoryRule.EVALUATION_ORDER)
                .filter(rule -> ruleMatcher.matches(rule, transaction))
                .next()
                .flatMap(rule -> ruleRepository.incrementMatchCount(rule.getId(), 1)
                        .then(Mono.justOrEmpty(acceptRule(rule, transaction))))
                .onErrorResume(e -> {
                    log.warn("Rule pass failed for transaction {}, continuing with classifier: {}",
                            transaction.getId(), e.getMessage());
                    return Mono.empty();
                });
    }

    private CategorizationResult acceptRule(CategoryRule rule, CanonicalTransaction transaction) {
        double confidence = rule.getConfidenceThreshold() != null
                ? rule.getConfidenceThreshold() : DEFAULT_RULE_CONFIDENCE;
        if (confidence < props.getConfidenceThreshold()) {
            log.debug("Rule '{}' matched transaction {} below threshold ({} < {})",
                    rule.getName(), transaction.getId(), confidence, props.getConfidenceThreshold());
            return null;
        }
        return CategorizationResult.builder()
                .categoryId(rule.getCategoryId())
                .confidence(confidence)
                .method(CategorizationMethod.RULE)
                .reason("rule '" + rule.getName() + "'")
                .ruleId(rule.getId())
                .build();
    }

    private Mono<CategorizationResult> classifierPass(CanonicalTransaction transaction) {
        return categoryRepository.findAvailableForCompany(transaction.getCompanyId())
                .collectList()
                .flatMap(categories -> classifier.classify(requestFor(transaction, categories))
                        .timeout(props.getClassifierTimeout())
                        .flatMap(verdict -> Mono.justOrEmpty(acceptVerdict(verdict, categories, transaction))))
                .onErrorResume(e -> {
                    log.warn("Classifier {} failed for transaction {}, using default category: {}",
                            classifier.name(), transaction.getId(), e.toString());
                    return Mono.empty();
                });
    }

    private CategorizationResult acceptVerdict(ClassifierVerdict verdict, List<Category> categories,
                                               CanonicalTransaction transaction) {
        Double confidence = verdict.confidence();
        if (confidence == null || confidence.isNaN() || confidence < 0.0 || confidence > 1.0) {
            log.warn("Discarding classifier verdict for transaction {}: unusable confidence {}",
                    transaction.getId(), confidence);
            return null;
        }
        Category category = CategoryResolver.resolve(verdict.categoryName(), categories).orElse(null);
        if (category == null) {
            log.warn("Discarding classifier verdict for transaction {}: unknown category '{}'",
                    transaction.getId(), verdict.categoryName());
            return null;
        }
        if (confidence < props.getConfidenceThreshold()) {
            log.debug("Classifier verdict '{}' for transaction {} below threshold ({} < {})",
                    category.getName(), transaction.getId(), confidence, props.getConfidenceThreshold());
            return null;
        }
        return CategorizationResult.builder()
                .categoryId(category.getId())
                .confidence(confidence)
                .method(CategorizationMethod.CLASSIFIER)
                .reason(verdict.reason())
                .build();
    }

    private Mono<CategorizationResult> defaultPass(CanonicalTransaction transaction) {
        String slug = transaction.isIncome() ? props.getDefaultIncomeSlug() : props.getDefaultExpenseSlug();
        return categoryRepository.findBySlugAndSystemTrue(slug)
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("System category '" + slug + "' is missing")))
                .map(category -> CategorizationResult.builder()
                        .categoryId(category.getId())
                        .confidence(props.getDefaultConfidence())
                        .method(CategorizationMethod.DEFAULT)
                        .reason(FALLBACK_REASON)
                        .build());
    }

    private ClassificationRequest requestFor(CanonicalTransaction t, List<Category> categories) {
        List<CandidateCategory> candidates = categories.stream()
                .map(c -> new CandidateCategory(c.getId(), c.getName(), c.getCategoryType(), keywords(c)))
                .toList();
        BigDecimal signed = t.getAmount() == null ? BigDecimal.ZERO : BigDecimal.valueOf(t.getAmount(), 2);
        return new ClassificationRequest(t.getCompanyId(), t.getDescription(), signed, t.getTransactionType(),
                t.getCounterpartName(), t.getOccurredAt(), candidates);
    }

    private List<String> keywords(Category category) {
        if (category.getKeywords() == null || category.getKeywords().isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(category.getKeywords(), new TypeReference<List<String>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Category {} has unreadable keywords: {}", category.getId(), e.getOriginalMessage());
            return List.of();
        }
    }

    private CategorizationDecision decisionFor(CanonicalTransaction t, CategorizationResult result, long elapsedMs) {
        return CategorizationDecision.builder()
                .transactionId(t.getId())
                .companyId(t.getCompanyId())
                .method(result.method())
                .suggestedCategoryId(result.categoryId())
                .confidence(result.confidence())
                .ruleId(result.ruleId())
                .classifierName(result.method() == CategorizationMethod.CLASSIFIER ? classifier.name() : null)
                .reason(result.reason())
                .processingTimeMs(elapsedMs)
                .createdAt(OffsetDateTime.now(clock))
                .build();
    }
}
