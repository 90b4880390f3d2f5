package com.bank_sync_engine.service.categorization;

import com.bank_sync_engine.config.CategorizationProperties;
import com.bank_sync_engine.dto.CategorizationResult;
import com.bank_sync_engine.exception.ValidationException;
import com.bank_sync_engine.model.CanonicalTransaction;
import com.bank_sync_engine.model.CategorizationDecision;
import com.bank_sync_engine.model.CategorizationMethod;
import com.bank_sync_engine.model.Category;
import com.bank_sync_engine.model.CategoryRule;
import com.bank_sync_engine.model.CategoryType;
import com.bank_sync_engine.model.RuleType;
import com.bank_sync_engine.model.TransactionType;
import com.bank_sync_engine.repository.CategorizationDecisionRepository;
import com.bank_sync_engine.repository.CategoryRepository;
import com.bank_sync_engine.repository.CategoryRuleRepository;
import com.bank_sync_engine.repository.TransactionRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CategorizationPipeline")
class CategorizationPipelineTest {

    private static final UUID COMPANY = UUID.randomUUID();
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-15T12:00:00Z"), ZoneOffset.UTC);

    private static final Category VENDAS = Category.builder().id(UUID.randomUUID()).name("Vendas")
            .slug("vendas").categoryType(CategoryType.INCOME).keywords("[\"venda\",\"cliente\"]").system(true).build();
    private static final Category OUTROS_RECEBIMENTOS = Category.builder().id(UUID.randomUUID())
            .name("Outros Recebimentos").slug("outros-recebimentos").categoryType(CategoryType.INCOME)
            .keywords("[]").system(true).build();

    @Mock
    private CategoryRuleRepository ruleRepository;
    @Mock
    private CategoryRepository categoryRepository;
    @Mock
    private CategorizationDecisionRepository decisionRepository;
    @Mock
    private TransactionRepository transactionRepository;
    @Mock
    private TransactionClassifier classifier;
    @Mock
    private TransactionalOperator transactionalOperator;

    private CategorizationPipeline pipeline;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        pipeline = new CategorizationPipeline(ruleRepository, categoryRepository, decisionRepository,
                transactionRepository, new RuleMatcher(objectMapper), classifier, transactionalOperator,
                new CategorizationProperties(), objectMapper, CLOCK);

        lenient().when(transactionalOperator.transactional(any(Mono.class))).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(classifier.name()).thenReturn("keyword-hints");
        lenient().when(ruleRepository.incrementMatchCount(any(), anyInt())).thenReturn(Mono.just(1));
        lenient().when(decisionRepository.save(any(CategorizationDecision.class)))
                .thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        lenient().when(transactionRepository.applyCategorization(any(), any(), anyDouble(), any()))
                .thenReturn(Mono.just(1));
        lenient().when(categoryRepository.findAvailableForCompany(COMPANY))
                .thenReturn(Flux.just(OUTROS_RECEBIMENTOS, VENDAS));
        lenient().when(categoryRepository.findBySlugAndSystemTrue("outros-recebimentos"))
                .thenReturn(Mono.just(OUTROS_RECEBIMENTOS));
    }

    private static CanonicalTransaction pixFromCustomer() {
        return CanonicalTransaction.builder()
                .id(UUID.randomUUID())
                .companyId(COMPANY)
                .transactionType(TransactionType.PIX_IN)
                .amount(100000L)
                .description("PIX recebido - Cliente ABC")
                .counterpartName("Cliente ABC")
                .occurredAt(OffsetDateTime.now(CLOCK))
                .manuallyReviewed(false)
                .build();
    }

    private static CategoryRule keywordRule(String name, int priority, double threshold, UUID categoryId) {
        return CategoryRule.builder()
                .id(UUID.randomUUID())
                .companyId(COMPANY)
                .categoryId(categoryId)
                .name(name)
                .ruleType(RuleType.KEYWORD)
                .conditions("{\"keywords\":[\"cliente\"]}")
                .priority(priority)
                .confidenceThreshold(threshold)
                .active(true)
                .build();
    }

    @Test
    @DisplayName("Should categorize a customer PIX by keyword rule and log one decision")
    void shouldCategorizeByRule() {
        // Given
        CanonicalTransaction t = pixFromCustomer();
        CategoryRule rule = keywordRule("Clientes", 10, 0.8, VENDAS.getId());
        when(ruleRepository.findByCompanyIdAndActiveTrue(COMPANY)).thenReturn(Flux.just(rule));

        // When
        StepVerifier.create(pipeline.categorize(t))
                .assertNext(result -> {
                    // Then
                    assertThat(result.categoryId()).isEqualTo(VENDAS.getId());
                    assertThat(result.method()).isEqualTo(CategorizationMethod.RULE);
                    assertThat(result.confidence()).isEqualTo(0.8);
                    assertThat(result.ruleId()).isEqualTo(rule.getId());
                })
                .verifyComplete();

        ArgumentCaptor<CategorizationDecision> decision = ArgumentCaptor.forClass(CategorizationDecision.class);
        verify(decisionRepository).save(decision.capture());
        assertThat(decision.getValue().getMethod()).isEqualTo(CategorizationMethod.RULE);
        assertThat(decision.getValue().getRuleId()).isEqualTo(rule.getId());
        assertThat(decision.getValue().getClassifierName()).isNull();
        assertThat(decision.getValue().getWasAccepted()).isNull();
        verify(transactionRepository).applyCategorization(eq(t.getId()), eq(VENDAS.getId()), eq(0.8), any());
        verify(ruleRepository).incrementMatchCount(rule.getId(), 1);
        verify(classifier, never()).classify(any());
    }

    @Test
    @DisplayName("Should pick the highest priority rule, then the first by name")
    void shouldOrderRulesDeterministically() {
        UUID low = UUID.randomUUID();
        UUID winner = UUID.randomUUID();
        UUID loser = UUID.randomUUID();
        when(ruleRepository.findByCompanyIdAndActiveTrue(COMPANY)).thenReturn(Flux.just(
                keywordRule("A low", 1, 0.9, low),
                keywordRule("Z high", 10, 0.9, loser),
                keywordRule("B high", 10, 0.9, winner)));

        StepVerifier.create(pipeline.evaluate(pixFromCustomer()))
                .assertNext(evaluation -> assertThat(evaluation.result().categoryId()).isEqualTo(winner))
                .verifyComplete();
    }

    @Test
    @DisplayName("Should accept a rule whose confidence equals the threshold")
    void shouldAcceptRuleAtThreshold() {
        when(ruleRepository.findByCompanyIdAndActiveTrue(COMPANY))
                .thenReturn(Flux.just(keywordRule("Clientes", 0, 0.7, VENDAS.getId())));

        StepVerifier.create(pipeline.evaluate(pixFromCustomer()))
                .assertNext(evaluation -> {
                    assertThat(evaluation.result().method()).isEqualTo(CategorizationMethod.RULE);
                    assertThat(evaluation.result().confidence()).isEqualTo(0.7);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should fall through to the classifier when the matching rule is below the threshold")
    void shouldSkipRuleBelowThreshold() {
        when(ruleRepository.findByCompanyIdAndActiveTrue(COMPANY))
                .thenReturn(Flux.just(keywordRule("Clientes", 0, 0.69, VENDAS.getId())));
        when(classifier.classify(any())).thenReturn(Mono.just(new ClassifierVerdict("Vendas", 0.7, "hint")));

        StepVerifier.create(pipeline.evaluate(pixFromCustomer()))
                .assertNext(evaluation -> {
                    CategorizationResult result = evaluation.result();
                    assertThat(result.method()).isEqualTo(CategorizationMethod.CLASSIFIER);
                    assertThat(result.categoryId()).isEqualTo(VENDAS.getId());
                    assertThat(evaluation.decision().getClassifierName()).isEqualTo("keyword-hints");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should use the default category at 0.1 when the classifier is not confident enough")
    void shouldFallBackOnLowConfidence() {
        when(ruleRepository.findByCompanyIdAndActiveTrue(COMPANY)).thenReturn(Flux.empty());
        when(classifier.classify(any())).thenReturn(Mono.just(new ClassifierVerdict("Vendas", 0.4, "weak")));

        StepVerifier.create(pipeline.evaluate(pixFromCustomer()))
                .assertNext(evaluation -> {
                    assertThat(evaluation.result().method()).isEqualTo(CategorizationMethod.DEFAULT);
                    assertThat(evaluation.result().categoryId()).isEqualTo(OUTROS_RECEBIMENTOS.getId());
                    assertThat(evaluation.result().confidence()).isEqualTo(0.1);
                    assertThat(evaluation.result().reason()).isEqualTo("fallback");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should fall through to the default category just below the classifier threshold")
    void shouldFallBackJustBelowThreshold() {
        when(ruleRepository.findByCompanyIdAndActiveTrue(COMPANY)).thenReturn(Flux.empty());
        when(classifier.classify(any())).thenReturn(Mono.just(new ClassifierVerdict("Vendas", 0.6999, "hint")));

        StepVerifier.create(pipeline.evaluate(pixFromCustomer()))
                .assertNext(evaluation -> {
                    assertThat(evaluation.result().method()).isEqualTo(CategorizationMethod.DEFAULT);
                    assertThat(evaluation.result().categoryId()).isEqualTo(OUTROS_RECEBIMENTOS.getId());
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should use the default category when the classifier fails or answers nonsense")
    void shouldFallBackOnClassifierError() {
        when(ruleRepository.findByCompanyIdAndActiveTrue(COMPANY)).thenReturn(Flux.empty());
        when(classifier.classify(any()))
                .thenReturn(Mono.error(new IllegalStateException("connection refused")))
                .thenReturn(Mono.just(new ClassifierVerdict("Vendas", Double.NaN, null)))
                .thenReturn(Mono.just(new ClassifierVerdict("Criptomoedas", 0.99, null)));

        for (int i = 0; i < 3; i++) {
            StepVerifier.create(pipeline.evaluate(pixFromCustomer()))
                    .assertNext(evaluation -> assertThat(evaluation.result().method())
                            .isEqualTo(CategorizationMethod.DEFAULT))
                    .verifyComplete();
        }
    }

    @Test
    @DisplayName("Should refuse to recategorize a manually reviewed transaction")
    void shouldRejectReviewedTransaction() {
        CanonicalTransaction reviewed = pixFromCustomer().toBuilder().manuallyReviewed(true).build();

        StepVerifier.create(pipeline.categorize(reviewed))
                .expectError(ValidationException.class)
                .verify();
        verify(decisionRepository, never()).save(any(CategorizationDecision.class));
    }
}
