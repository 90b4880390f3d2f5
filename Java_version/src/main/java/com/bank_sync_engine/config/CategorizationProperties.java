package com.bank_sync_engine.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "categorization")
public class CategorizationProperties {
    /** Results are accepted when confidence >= this value. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double confidenceThreshold = 0.7;
    private double defaultConfidence = 0.1;
    /** keyword | llm */
    private String classifier = "keyword";
    private Duration classifierTimeout = Duration.ofSeconds(30);
    private String defaultIncomeSlug = "outros-recebimentos";
    private String defaultExpenseSlug = "outros-gastos";
    private int sweepLimit = 100;
    private Llm llm = new Llm();

    @Data
    public static class Llm {
        private String baseUrl = "https://api.openai.com";
        private String apiKey;
        private String model = "gpt-3.5-turbo";
        private double temperature = 0.1;
        private int maxTokens = 150;
    }
}
