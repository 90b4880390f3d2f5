package com.bank_sync_engine.service.categorization;

import com.bank_sync_engine.dto.CreateRuleRequest;
import com.bank_sync_engine.dto.RuleSuggestion;
import com.bank_sync_engine.exception.ResourceNotFoundException;
import com.bank_sync_engine.exception.ValidationException;
import com.bank_sync_engine.model.CategoryRule;
import com.bank_sync_engine.repository.CategoryRepository;
import com.bank_sync_engine.repository.CategoryRuleRepository;
import com.bank_sync_engine.repository.TransactionRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

@Slf4j
@Service
@RequiredArgsConstructor
public class CategoryRuleService {

    static final int SUGGESTION_MIN_OCCURRENCES = 3;
    private static final int SUGGESTION_MAX_KEYWORDS = 3;
    private static final Pattern WORD = Pattern.compile("\\p{L}{3,}");
    // Words that appear in most bank statement lines and say nothing about the category.
    private static final Set<String> STOP_WORDS = Set.of(
            "pix", "ted", "doc", "transferencia", "pagamento", "compra", "debito", "credito", "saque",
            "deposito", "taxa", "tarifa", "banco", "caixa", "conta", "cartao", "de", "do", "da", "para",
            "em", "com", "por", "ate", "desde", "ltda", "me", "eireli");

    private final CategoryRuleRepository ruleRepository;
    private final CategoryRepository categoryRepository;
    private final TransactionRepository transactionRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public Mono<CategoryRule> createRule(UUID companyId, CreateRuleRequest request) {
        return categoryRepository.findAvailableForCompany(companyId)
                .filter(c -> c.getId().equals(request.categoryId()))
                .next()
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Category", request.categoryId())))
                .flatMap(category -> {
                    RuleConditions conditions = conditionsFor(request);
                    OffsetDateTime now = OffsetDateTime.now(clock);
                    CategoryRule rule = CategoryRule.builder()
                            .companyId(companyId)
                            .categoryId(category.getId())
                            .name(request.name().trim())
                            .ruleType(request.ruleType())
                            .conditions(write(conditions))
                            .priority(request.priority() != null ? request.priority() : 0)
                            .confidenceThreshold(request.confidenceThreshold() != null
                                    ? request.confidenceThreshold() : CategorizationPipeline.DEFAULT_RULE_CONFIDENCE)
                            .matchCount(0)
                            .active(true)
                            .createdAt(now)
                            .updatedAt(now)
                            .build();
                    return ruleRepository.save(rule);
                })
                .doOnNext(rule -> log.info("Created {} rule '{}' for company {}",
                        rule.getRuleType().wireValue(), rule.getName(), companyId));
    }

    public Flux<CategoryRule> listRules(UUID companyId) {
        return ruleRepository.findByCompanyId(companyId)
                .sort(CategoryRule.EVALUATION_ORDER);
    }

    /**
     * Proposes keyword rules from descriptions that were given the same category at least three
     * times. Nothing is persisted.
     */
    public Flux<RuleSuggestion> suggestRules(UUID companyId) {
        return transactionRepository.findFrequentCategorizedDescriptions(companyId, SUGGESTION_MIN_OCCURRENCES)
                .flatMap(frequency -> {
                    List<String> keywords = extractKeywords(frequency.description());
                    if (keywords.isEmpty()) {
                        return Mono.empty();
                    }
                    long occurrences = frequency.occurrences() != null ? frequency.occurrences() : 0L;
                    return Mono.just(RuleSuggestion.builder()
                            .categoryId(frequency.categoryId())
                            .keywords(keywords)
                            .sampleDescription(frequency.description())
                            .occurrences(occurrences)
                            .confidence(Math.min(0.9, occurrences / 10.0))
                            .build());
                });
    }

    static List<String> extractKeywords(String description) {
        List<String> keywords = new ArrayList<>();
        if (description == null) {
            return keywords;
        }
        Matcher m = WORD.matcher(description.toLowerCase(Locale.ROOT));
        while (m.find() && keywords.size() < SUGGESTION_MAX_KEYWORDS) {
            String word = m.group();
            if (!STOP_WORDS.contains(word) && !keywords.contains(word)) {
                keywords.add(word);
            }
        }
        return keywords;
    }

    private static RuleConditions conditionsFor(CreateRuleRequest request) {
        return switch (request.ruleType()) {
            case KEYWORD -> RuleConditions.keywords(requireTerms(request.keywords(), "keywords"));
            case COUNTERPART -> RuleConditions.counterparts(requireTerms(request.counterparts(), "counterparts"));
            case AMOUNT_RANGE -> {
                BigDecimal min = request.minAmount();
                BigDecimal max = request.maxAmount();
                if (min == null && max == null) {
                    throw new ValidationException("amount_range rules need min_amount or max_amount");
                }
                if ((min != null && min.signum() < 0) || (max != null && max.signum() < 0)) {
                    throw new ValidationException("amount bounds are absolute values and cannot be negative");
                }
                if (min != null && max != null && min.compareTo(max) > 0) {
                    throw new ValidationException("min_amount is greater than max_amount");
                }
                yield RuleConditions.amountRange(min, max);
            }
            case PATTERN -> {
                String pattern = request.pattern();
                if (pattern == null || pattern.isEmpty()) {
                    throw new ValidationException("pattern rules need a pattern");
                }
                try {
                    Pattern.compile(pattern);
                } catch (PatternSyntaxException e) {
                    throw new ValidationException("pattern does not compile: " + e.getDescription());
                }
                yield RuleConditions.pattern(pattern);
            }
        };
    }

    private static List<String> requireTerms(List<String> terms, String field) {
        List<String> cleaned = terms == null ? List.of() : terms.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(String::trim)
                .toList();
        if (cleaned.isEmpty()) {
            throw new ValidationException(field + " must contain at least one non-blank entry");
        }
        return cleaned;
    }

    private String write(RuleConditions conditions) {
        try {
            return objectMapper.writeValueAsString(conditions);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize rule conditions", e);
        }
    }
}
