package com.bank_sync_engine.openbanking;

import com.bank_sync_engine.config.OpenBankingProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@ConditionalOnProperty(prefix = "open-banking", name = "mode", havingValue = "production")
public class ProductionOpenBankingConfig {

    @Bean
    public ClientAssertionSigner clientAssertionSigner(OpenBankingProperties props, Clock clock) {
        return ClientAssertionSigner.fromProperties(props, clock);
    }
}
