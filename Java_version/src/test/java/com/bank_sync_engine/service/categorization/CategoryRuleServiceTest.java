package com.bank_sync_engine.service.categorization;

import com.bank_sync_engine.dto.CreateRuleRequest;
import com.bank_sync_engine.exception.ResourceNotFoundException;
import com.bank_sync_engine.exception.ValidationException;
import com.bank_sync_engine.model.Category;
import com.bank_sync_engine.model.CategoryRule;
import com.bank_sync_engine.model.RuleType;
import com.bank_sync_engine.repository.CategoryRepository;
import com.bank_sync_engine.repository.CategoryRuleRepository;
import com.bank_sync_engine.repository.TransactionRepository;
import com.bank_sync_engine.repository.TransactionRepository.DescriptionFrequency;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CategoryRuleService")
class CategoryRuleServiceTest {

    private static final UUID COMPANY = UUID.randomUUID();
    private static final Category ALUGUEL = Category.builder().id(UUID.randomUUID()).name("Aluguel").build();

    @Mock
    private CategoryRuleRepository ruleRepository;
    @Mock
    private CategoryRepository categoryRepository;
    @Mock
    private TransactionRepository transactionRepository;

    private CategoryRuleService service;

    @BeforeEach
    void setUp() {
        service = new CategoryRuleService(ruleRepository, categoryRepository, transactionRepository, new ObjectMapper(),
                Clock.fixed(Instant.parse("2024-03-15T12:00:00Z"), ZoneOffset.UTC));
        lenient().when(categoryRepository.findAvailableForCompany(COMPANY)).thenReturn(Flux.just(ALUGUEL));
        lenient().when(ruleRepository.save(any(CategoryRule.class))).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
    }

    private static CreateRuleRequest request(RuleType type, List<String> keywords, BigDecimal min, BigDecimal max,
                                             String pattern) {
        return new CreateRuleRequest("Aluguel mensal", ALUGUEL.getId(), type, keywords, min, max, null, pattern,
                null, null);
    }

    @Test
    @DisplayName("Should create a keyword rule with defaults and serialized conditions")
    void shouldCreateKeywordRule() {
        StepVerifier.create(service.createRule(COMPANY, request(RuleType.KEYWORD, List.of(" aluguel ", ""), null, null, null)))
                .assertNext(rule -> {
                    assertThat(rule.getCompanyId()).isEqualTo(COMPANY);
                    assertThat(rule.getPriority()).isZero();
                    assertThat(rule.getConfidenceThreshold()).isEqualTo(0.8);
                    assertThat(rule.getMatchCount()).isZero();
                    assertThat(rule.getActive()).isTrue();
                    assertThat(rule.getConditions()).isEqualTo("{\"keywords\":[\"aluguel\"]}");
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should reject malformed patterns and inverted amount ranges")
    void shouldValidateConditions() {
        StepVerifier.create(service.createRule(COMPANY, request(RuleType.PATTERN, null, null, null, "([a-z")))
                .expectError(ValidationException.class)
                .verify();
        StepVerifier.create(service.createRule(COMPANY,
                        request(RuleType.AMOUNT_RANGE, null, new BigDecimal("500"), new BigDecimal("100"), null)))
                .expectError(ValidationException.class)
                .verify();
        StepVerifier.create(service.createRule(COMPANY, request(RuleType.KEYWORD, List.of(" "), null, null, null)))
                .expectError(ValidationException.class)
                .verify();
        verify(ruleRepository, never()).save(any(CategoryRule.class));
    }

    @Test
    @DisplayName("Should reject a category the company cannot use")
    void shouldRejectUnknownCategory() {
        CreateRuleRequest foreign = new CreateRuleRequest("x", UUID.randomUUID(), RuleType.KEYWORD, List.of("x"),
                null, null, null, null, null, null);

        StepVerifier.create(service.createRule(COMPANY, foreign))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }

    @Test
    @DisplayName("Should suggest up to three non-generic keywords per frequent description")
    void shouldSuggestRules() {
        when(transactionRepository.findFrequentCategorizedDescriptions(COMPANY, 3)).thenReturn(Flux.just(
                new DescriptionFrequency("PIX enviado para Imobiliaria Centro aluguel sala", ALUGUEL.getId(), 12L),
                new DescriptionFrequency("TED DOC PIX", ALUGUEL.getId(), 5L)));

        StepVerifier.create(service.suggestRules(COMPANY).collectList())
                .assertNext(suggestions -> {
                    assertThat(suggestions).hasSize(1);
                    assertThat(suggestions.get(0).keywords()).containsExactly("enviado", "imobiliaria", "centro");
                    assertThat(suggestions.get(0).confidence()).isEqualTo(0.9);
                    assertThat(suggestions.get(0).occurrences()).isEqualTo(12L);
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should list rules in evaluation order")
    void shouldListRulesInOrder() {
        CategoryRule low = CategoryRule.builder().name("A").priority(1).build();
        CategoryRule highB = CategoryRule.builder().name("B").priority(5).build();
        CategoryRule highA = CategoryRule.builder().name("A").priority(5).build();
        when(ruleRepository.findByCompanyId(COMPANY)).thenReturn(Flux.just(low, highB, highA));

        StepVerifier.create(service.listRules(COMPANY))
                .expectNext(highA, highB, low)
                .verifyComplete();
    }
}
