package com.bank_sync_engine.service.categorization;

import com.bank_sync_engine.config.CategorizationProperties;
import com.bank_sync_engine.model.CategoryType;
import com.bank_sync_engine.model.TransactionType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LlmTransactionClassifier")
class LlmTransactionClassifierTest {

    private static final ClassificationRequest REQUEST = new ClassificationRequest(UUID.randomUUID(),
            "PIX recebido - Cliente ABC", new BigDecimal("1000.00"), TransactionType.PIX_IN, "Cliente ABC",
            OffsetDateTime.of(2024, 3, 15, 10, 0, 0, 0, ZoneOffset.UTC),
            List.of(new CandidateCategory(UUID.randomUUID(), "Vendas", CategoryType.INCOME, List.of("venda", "pedido")),
                    new CandidateCategory(UUID.randomUUID(), "Outros", CategoryType.EXPENSE, List.of())));

    private static LlmTransactionClassifier classifier(HttpStatus status, String body, AtomicReference<ClientRequest> seen) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://llm.test")
                .exchangeFunction(request -> {
                    seen.set(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new LlmTransactionClassifier(webClient, new CategorizationProperties());
    }

    @Test
    @DisplayName("Should parse the verdict from the first choice")
    void shouldParseVerdict() {
        // Given
        AtomicReference<ClientRequest> seen = new AtomicReference<>();
        String body = """
                {"choices":[{"message":{"role":"assistant","content":"CATEGORY: Vendas\\nCONFIDENCE: 0.92\\nREASON: customer payment"}}]}
                """;

        // When / Then
        StepVerifier.create(classifier(HttpStatus.OK, body, seen).classify(REQUEST))
                .assertNext(v -> {
                    assertThat(v.categoryName()).isEqualTo("Vendas");
                    assertThat(v.confidence()).isEqualTo(0.92);
                })
                .verifyComplete();
        assertThat(seen.get().url().getPath()).isEqualTo("/v1/chat/completions");
    }

    @Test
    @DisplayName("Should complete empty when the reply names no category")
    void shouldIgnoreReplyWithoutCategory() {
        String body = """
                {"choices":[{"message":{"role":"assistant","content":"I am not sure."}}]}
                """;

        StepVerifier.create(classifier(HttpStatus.OK, body, new AtomicReference<>()).classify(REQUEST))
                .verifyComplete();
    }

    @Test
    @DisplayName("Should surface HTTP failures for the pipeline to absorb")
    void shouldPropagateHttpErrors() {
        StepVerifier.create(classifier(HttpStatus.INTERNAL_SERVER_ERROR, "{}", new AtomicReference<>()).classify(REQUEST))
                .expectError(WebClientResponseException.class)
                .verify();
    }

    @Test
    @DisplayName("Should describe the transaction and every candidate category in the prompt")
    void shouldBuildPrompt() {
        String prompt = LlmTransactionClassifier.prompt(REQUEST);

        assertThat(prompt)
                .contains("Description: PIX recebido - Cliente ABC")
                .contains("Amount: R$ 1000.00")
                .contains("Date: 15/03/2024")
                .contains("- Vendas: venda, pedido")
                .contains("- Outros")
                .contains("CATEGORY:");
    }
}
