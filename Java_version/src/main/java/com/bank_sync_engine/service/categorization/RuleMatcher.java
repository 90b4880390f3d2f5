package com.bank_sync_engine.service.categorization;

import com.bank_sync_engine.model.CanonicalTransaction;
import com.bank_sync_engine.model.CategoryRule;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates one rule against one transaction. Never throws: unreadable conditions and malformed
 * patterns simply do not match.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RuleMatcher {

    private static final BigDecimal NO_UPPER_BOUND = new BigDecimal("999999999");

    private final ObjectMapper objectMapper;

    private final Map<String, Optional<Pattern>> patterns = new ConcurrentHashMap<>();

    public boolean matches(CategoryRule rule, CanonicalTransaction transaction) {
        RuleConditions conditions = parse(rule);
        if (conditions == null || rule.getRuleType() == null) {
            return false;
        }
        return switch (rule.getRuleType()) {
            case KEYWORD -> containsAny(transaction.getDescription(), conditions.keywords());
            case COUNTERPART -> containsAny(transaction.getCounterpartName(), conditions.counterparts());
            case AMOUNT_RANGE -> inRange(transaction.absoluteAmount(), conditions);
            case PATTERN -> patternFinds(rule, conditions.pattern(), transaction.getDescription());
        };
    }

    RuleConditions parse(CategoryRule rule) {
        if (rule.getConditions() == null || rule.getConditions().isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(rule.getConditions(), RuleConditions.class);
        } catch (JsonProcessingException e) {
            log.warn("Rule {} has unreadable conditions, ignoring it: {}", rule.getId(), e.getOriginalMessage());
            return null;
        }
    }

    private static boolean containsAny(String text, List<String> needles) {
        if (text == null || needles == null) {
            return false;
        }
        String haystack = text.toLowerCase(Locale.ROOT);
        return needles.stream()
                .filter(n -> n != null && !n.isBlank())
                .anyMatch(n -> haystack.contains(n.toLowerCase(Locale.ROOT)));
    }

    private static boolean inRange(BigDecimal absoluteAmount, RuleConditions conditions) {
        BigDecimal min = conditions.minAmount() != null ? conditions.minAmount() : BigDecimal.ZERO;
        BigDecimal max = conditions.maxAmount() != null ? conditions.maxAmount() : NO_UPPER_BOUND;
        return min.compareTo(absoluteAmount) <= 0 && absoluteAmount.compareTo(max) <= 0;
    }

    private boolean patternFinds(CategoryRule rule, String regex, String description) {
        if (regex == null || regex.isEmpty() || description == null) {
            return false;
        }
        Optional<Pattern> compiled = patterns.computeIfAbsent(regex, r -> {
            try {
                return Optional.of(Pattern.compile(r, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
            } catch (PatternSyntaxException e) {
                log.warn("Rule {} has a malformed pattern '{}', it will never match", rule.getId(), r);
                return Optional.empty();
            }
        });
        return compiled.map(p -> p.matcher(description).find()).orElse(false);
    }
}
