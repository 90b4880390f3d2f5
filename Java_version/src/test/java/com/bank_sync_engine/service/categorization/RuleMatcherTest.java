package com.bank_sync_engine.service.categorization;

import com.bank_sync_engine.model.CanonicalTransaction;
import com.bank_sync_engine.model.CategoryRule;
import com.bank_sync_engine.model.RuleType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RuleMatcher")
class RuleMatcherTest {

    private final RuleMatcher matcher = new RuleMatcher(new ObjectMapper());

    private static CategoryRule rule(RuleType type, String conditions) {
        return CategoryRule.builder()
                .id(UUID.randomUUID())
                .name("rule")
                .ruleType(type)
                .conditions(conditions)
                .build();
    }

    private static CanonicalTransaction transaction(String description, long amountMinor, String counterpart) {
        return CanonicalTransaction.builder()
                .id(UUID.randomUUID())
                .description(description)
                .amount(amountMinor)
                .counterpartName(counterpart)
                .build();
    }

    @Test
    @DisplayName("Should match keywords case-insensitively as substrings of the description")
    void shouldMatchKeywords() {
        CategoryRule rule = rule(RuleType.KEYWORD, "{\"keywords\":[\"cliente\",\"venda\"]}");

        assertThat(matcher.matches(rule, transaction("PIX recebido - CLIENTE ABC", 100000, null))).isTrue();
        assertThat(matcher.matches(rule, transaction("Tarifa mensal", -1500, null))).isFalse();
    }

    @Test
    @DisplayName("Should compare amount ranges against the absolute amount, bounds inclusive")
    void shouldMatchAmountRange() {
        CategoryRule rule = rule(RuleType.AMOUNT_RANGE, "{\"min_amount\":100,\"max_amount\":500}");

        assertThat(matcher.matches(rule, transaction("a", -10000, null))).isTrue();
        assertThat(matcher.matches(rule, transaction("a", 50000, null))).isTrue();
        assertThat(matcher.matches(rule, transaction("a", 50001, null))).isFalse();
        assertThat(matcher.matches(rule, transaction("a", 9999, null))).isFalse();
    }

    @Test
    @DisplayName("Should default missing amount bounds")
    void shouldDefaultBounds() {
        CategoryRule onlyMin = rule(RuleType.AMOUNT_RANGE, "{\"min_amount\":1000}");

        assertThat(matcher.matches(onlyMin, transaction("a", 500000000, null))).isTrue();
        assertThat(matcher.matches(onlyMin, transaction("a", 99999, null))).isFalse();
    }

    @Test
    @DisplayName("Should match counterparts against the counterpart name only")
    void shouldMatchCounterpart() {
        CategoryRule rule = rule(RuleType.COUNTERPART, "{\"counterparts\":[\"Imobiliaria\"]}");

        assertThat(matcher.matches(rule, transaction("Aluguel", -300000, "IMOBILIARIA CENTRO"))).isTrue();
        assertThat(matcher.matches(rule, transaction("Imobiliaria", -300000, null))).isFalse();
    }

    @Test
    @DisplayName("Should search patterns case-insensitively anywhere in the description")
    void shouldMatchPattern() {
        CategoryRule rule = rule(RuleType.PATTERN, "{\"pattern\":\"^pix .* cliente \\\\w+$\"}");

        assertThat(matcher.matches(rule, transaction("PIX recebido - Cliente ABC", 100000, null))).isTrue();
        assertThat(matcher.matches(rule, transaction("TED recebida - Cliente ABC", 100000, null))).isFalse();
    }

    @Test
    @DisplayName("Should never match a malformed pattern or unreadable conditions")
    void shouldIgnoreBrokenRules() {
        CategoryRule malformed = rule(RuleType.PATTERN, "{\"pattern\":\"([a-z\"}");
        CategoryRule unreadable = rule(RuleType.KEYWORD, "not json");
        CategoryRule empty = rule(RuleType.KEYWORD, null);

        CanonicalTransaction t = transaction("([a-z anything", 100, null);
        assertThat(matcher.matches(malformed, t)).isFalse();
        assertThat(matcher.matches(malformed, t)).isFalse();
        assertThat(matcher.matches(unreadable, t)).isFalse();
        assertThat(matcher.matches(empty, t)).isFalse();
    }
}
