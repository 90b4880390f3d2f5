package com.bank_sync_engine.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "open-banking")
public class OpenBankingProperties {
    /** sandbox | production */
    private String mode = "sandbox";
    @NotBlank
    private String clientId;
    @NotBlank
    private String redirectUri;
    private List<String> scopes = List.of("openid", "accounts", "transactions");
    private String sandboxBaseUrl = "http://localhost:8080/sandbox";

    // mutual TLS material (PEM); production only
    private String clientCertPath;
    private String clientKeyPath;
    private String caCertPath;
    /** PKCS#8 PEM RSA key used to sign client assertions */
    private String signingKeyPath;

    private Duration assertionTtl = Duration.ofMinutes(5);
    private Duration consentTtl = Duration.ofMinutes(15);
    private int connectTimeoutMillis = 5000;
    private int responseTimeoutMillis = 30000;

    public boolean isSandbox() {
        return !"production".equalsIgnoreCase(mode);
    }
}
