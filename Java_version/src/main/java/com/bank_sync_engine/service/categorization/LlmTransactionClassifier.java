package com.bank_sync_engine.service.categorization;

import com.bank_sync_engine.config.CategorizationProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Chat-completion backed classifier (OpenAI-compatible API). The model is asked to answer in the
 * line format read by {@link ClassifierResponseParser}.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "categorization", name = "classifier", havingValue = "llm")
public class LlmTransactionClassifier implements TransactionClassifier {

    static final String SYSTEM_PROMPT =
            "You are an expert in categorizing financial transactions of Brazilian businesses.";

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    private final WebClient webClient;
    private final CategorizationProperties props;

    public LlmTransactionClassifier(@Qualifier("classifierWebClient") WebClient webClient,
                                    CategorizationProperties props) {
        this.webClient = webClient;
        this.props = props;
    }

    record ChatMessage(String role, String content) {}

    record ChatRequest(
            String model,
            List<ChatMessage> messages,
            double temperature,
            @JsonProperty("max_tokens") int maxTokens
    ) {}

    record ChatResponse(List<Choice> choices) {
        record Choice(ChatMessage message) {}
    }

    @Override
    public Mono<ClassifierVerdict> classify(ClassificationRequest request) {
        CategorizationProperties.Llm llm = props.getLlm();
        ChatRequest body = new ChatRequest(llm.getModel(),
                List.of(new ChatMessage("system", SYSTEM_PROMPT), new ChatMessage("user", prompt(request))),
                llm.getTemperature(), llm.getMaxTokens());

        return webClient.post()
                .uri("/v1/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(ChatResponse.class)
                .flatMap(response -> Mono.justOrEmpty(Optional.ofNullable(response.choices())
                        .filter(choices -> !choices.isEmpty())
                        .map(choices -> choices.get(0).message())
                        .map(ChatMessage::content)))
                .flatMap(content -> {
                    ClassifierVerdict verdict = ClassifierResponseParser.parse(content);
                    if (verdict == null) {
                        log.warn("Classifier reply without a category, ignoring it");
                    }
                    return Mono.justOrEmpty(verdict);
                });
    }

    @Override
    public String name() {
        return props.getLlm().getModel();
    }

    static String prompt(ClassificationRequest request) {
        String categories = request.candidates().stream()
                .map(c -> c.keywords() == null || c.keywords().isEmpty()
                        ? "- " + c.name()
                        : "- " + c.name() + ": " + String.join(", ", c.keywords()))
                .collect(Collectors.joining("\n"));

        return """
                Categorize this financial transaction:

                Description: %s
                Amount: R$ %s
                Type: %s
                Counterpart: %s
                Date: %s

                Available categories:
                %s

                Answer ONLY in this format:
                CATEGORY: [category name]
                CONFIDENCE: [0.0 to 1.0]
                REASON: [short explanation]
                """.formatted(
                request.description(),
                request.amount() != null ? request.amount().toPlainString() : "",
                request.type() != null ? request.type().wireValue() : "",
                request.counterpartName() != null ? request.counterpartName() : "",
                request.occurredAt() != null ? request.occurredAt().format(DATE) : "",
                categories);
    }
}
