package com.bank_sync_engine.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "vault")
public class VaultProperties {
    /** base64 encoded 256-bit AES key */
    @NotBlank
    private String masterKey;
}
