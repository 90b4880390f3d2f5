package com.bank_sync_engine.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "sync")
public class SyncProperties {
    @Min(1)
    private int daysBack = 30;
    private Duration maxDuration = Duration.ofMinutes(5);
    @Min(1)
    private int batchSize = 100;
    @Min(1)
    private int workerConcurrency = 4;
    private int syncFrequencyHours = 4;
    private long scheduleDelayMillis = 15 * 60 * 1000L;
    private Duration tokenRefreshSkew = Duration.ofSeconds(60);
    private int eventBufferSize = 1024;
    private int runRetentionDays = 30;
    private Retry retry = new Retry();

    @Data
    public static class Retry {
        private int maxAttempts = 3;
        private Duration minBackoff = Duration.ofMinutes(1);
        private Duration maxBackoff = Duration.ofMinutes(10);
    }
}
