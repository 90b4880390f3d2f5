package com.bank_sync_engine.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import javax.net.ssl.SSLException;
import java.io.File;
import java.time.Duration;

@Slf4j
@Configuration
@EnableConfigurationProperties({
        OpenBankingProperties.class,
        SyncProperties.class,
        CategorizationProperties.class,
        VaultProperties.class
})
public class OpenBankingWebClientConfig {

    /**
     * Client for bank authorization, token and account endpoints. Endpoints differ per provider, so
     * there is no base URL; callers pass absolute URIs. Presents the client certificate when TLS
     * material is configured.
     */
    @Bean
    @Qualifier("openBankingWebClient")
    public WebClient openBankingWebClient(OpenBankingProperties props) {
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, props.getConnectTimeoutMillis())
                .responseTimeout(Duration.ofMillis(props.getResponseTimeoutMillis()));

        if (props.getClientCertPath() != null && !props.getClientCertPath().isBlank()) {
            SslContext sslContext = mutualTlsContext(props);
            httpClient = httpClient.secure(spec -> spec.sslContext(sslContext));
            log.info("Open Banking client configured for mutual TLS");
        }

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(cfg -> cfg.defaultCodecs().maxInMemorySize(16 * 1024 * 1024)) // 16 MB
                .build();

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies)
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader("User-Agent", "bank-sync-engine/1.0")
                .build();
    }

    @Bean
    @Qualifier("classifierWebClient")
    public WebClient classifierWebClient(CategorizationProperties props) {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(props.getClassifierTimeout());

        WebClient.Builder builder = WebClient.builder()
                .baseUrl(props.getLlm().getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE);
        if (props.getLlm().getApiKey() != null && !props.getLlm().getApiKey().isBlank()) {
            builder.defaultHeader("Authorization", "Bearer " + props.getLlm().getApiKey());
        }
        return builder.build();
    }

    private static SslContext mutualTlsContext(OpenBankingProperties props) {
        try {
            SslContextBuilder builder = SslContextBuilder.forClient()
                    .keyManager(new File(props.getClientCertPath()), new File(props.getClientKeyPath()));
            if (props.getCaCertPath() != null && !props.getCaCertPath().isBlank()) {
                builder.trustManager(new File(props.getCaCertPath()));
            }
            return builder.build();
        } catch (SSLException e) {
            throw new IllegalStateException("Cannot build mutual TLS context from configured certificates", e);
        }
    }
}
