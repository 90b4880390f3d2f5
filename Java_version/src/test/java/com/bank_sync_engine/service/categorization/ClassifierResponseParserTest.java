package com.bank_sync_engine.service.categorization;

import com.bank_sync_engine.model.Category;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ClassifierResponseParser and CategoryResolver")
class ClassifierResponseParserTest {

    @Test
    @DisplayName("Should read category, confidence and reason lines in any case")
    void shouldParseReply() {
        ClassifierVerdict verdict = ClassifierResponseParser.parse("""
                Category: Vendas
                CONFIDENCE: 0.85
                REASON: recurring customer payment
                """);

        assertThat(verdict).isNotNull();
        assertThat(verdict.categoryName()).isEqualTo("Vendas");
        assertThat(verdict.confidence()).isEqualTo(0.85);
        assertThat(verdict.reason()).isEqualTo("recurring customer payment");
    }

    @Test
    @DisplayName("Should accept comma decimals and percentages")
    void shouldParseConfidenceFormats() {
        assertThat(ClassifierResponseParser.parseConfidence("0,7")).isEqualTo(0.7);
        assertThat(ClassifierResponseParser.parseConfidence("85%")).isEqualTo(0.85);
        assertThat(ClassifierResponseParser.parseConfidence("high")).isNull();
        assertThat(ClassifierResponseParser.parseConfidence("NaN")).isNull();
    }

    @Test
    @DisplayName("Should return null when no category is named")
    void shouldRejectReplyWithoutCategory() {
        assertThat(ClassifierResponseParser.parse("CONFIDENCE: 0.9")).isNull();
        assertThat(ClassifierResponseParser.parse(null)).isNull();
    }

    @Test
    @DisplayName("Should resolve exact names first, then partial names")
    void shouldResolveCategoryNames() {
        Category vendas = Category.builder().id(UUID.randomUUID()).name("Vendas").build();
        Category servicos = Category.builder().id(UUID.randomUUID()).name("Serviços").build();
        Category taxas = Category.builder().id(UUID.randomUUID()).name("Taxas Bancárias").build();
        List<Category> categories = List.of(vendas, servicos, taxas);

        assertThat(CategoryResolver.resolve("vendas", categories)).contains(vendas);
        assertThat(CategoryResolver.resolve("Taxas", categories)).contains(taxas);
        assertThat(CategoryResolver.resolve("Vendas de produtos", categories)).contains(vendas);
        assertThat(CategoryResolver.resolve("Marketing", categories)).isEmpty();
        assertThat(CategoryResolver.resolve(" ", categories)).isEmpty();
    }
}
