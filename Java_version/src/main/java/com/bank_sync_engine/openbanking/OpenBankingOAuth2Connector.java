package com.bank_sync_engine.openbanking;

import com.bank_sync_engine.config.OpenBankingProperties;
import com.bank_sync_engine.exception.InvalidGrantException;
import com.bank_sync_engine.exception.ProviderUnavailableException;
import com.bank_sync_engine.model.BankProvider;
import com.bank_sync_engine.vault.TokenSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Talks to the bank's real authorization server. Token calls authenticate with a signed client
 * assertion and go out over the mutual-TLS client.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "open-banking", name = "mode", havingValue = "production")
public class OpenBankingOAuth2Connector implements OAuth2Connector {

    private static final Pattern CODE_FORMAT = Pattern.compile("[A-Za-z0-9._~\\-]{8,512}");

    private final WebClient webClient;
    private final ProviderRegistry providerRegistry;
    private final ClientAssertionSigner assertionSigner;
    private final OpenBankingProperties props;

    public OpenBankingOAuth2Connector(@Qualifier("openBankingWebClient") WebClient webClient,
                                      ProviderRegistry providerRegistry,
                                      ClientAssertionSigner assertionSigner,
                                      OpenBankingProperties props) {
        this.webClient = webClient;
        this.providerRegistry = providerRegistry;
        this.assertionSigner = assertionSigner;
        this.props = props;
    }

    @Override
    public Mono<ConsentGrant> initiateConsent(String providerCode, List<String> permissions) {
        return providerRegistry.require(providerCode)
                .map(provider -> {
                    String consentId = "urn:consent:" + UUID.randomUUID();
                    String state = UUID.randomUUID().toString();
                    String nonce = UUID.randomUUID().toString();
                    String url = AuthorizationUrls.build(provider.getAuthorizationEndpoint(), props, permissions,
                            consentId, state, nonce);
                    log.info("Consent {} created for provider {}", consentId, providerCode);
                    return new ConsentGrant(consentId, url, state, nonce, props.getConsentTtl().toSeconds());
                });
    }

    @Override
    public Mono<TokenSet> exchangeCode(String authorizationCode, String providerCode) {
        return providerRegistry.require(providerCode)
                .flatMap(provider -> {
                    validateCode(authorizationCode, provider);
                    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
                    form.add("grant_type", "authorization_code");
                    form.add("code", authorizationCode);
                    form.add("redirect_uri", props.getRedirectUri());
                    return tokenCall(provider, form, "Authorization code exchange");
                });
    }

    @Override
    public Mono<TokenSet> refreshToken(String refreshToken, String providerCode) {
        return providerRegistry.require(providerCode)
                .flatMap(provider -> {
                    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
                    form.add("grant_type", "refresh_token");
                    form.add("refresh_token", refreshToken);
                    return tokenCall(provider, form, "Token refresh");
                });
    }

    private Mono<TokenSet> tokenCall(BankProvider provider, MultiValueMap<String, String> form, String operation) {
        form.add("client_id", props.getClientId());
        form.add("client_assertion_type", ClientAssertionSigner.ASSERTION_TYPE);
        // minted per call: unique jti, short expiry
        form.add("client_assertion", assertionSigner.sign(provider.getTokenEndpoint()));

        return webClient.post()
                .uri(provider.getTokenEndpoint())
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData(form))
                .retrieve()
                .bodyToMono(TokenSet.class)
                .onErrorMap(e -> ProviderErrorTranslator.translateTokenError(e, operation))
                .flatMap(tokens -> {
                    if (tokens.accessToken() == null || tokens.accessToken().isBlank()) {
                        return Mono.error(new ProviderUnavailableException(
                                operation + " returned no access_token", false, null));
                    }
                    return Mono.just(tokens);
                });
    }

    private static void validateCode(String code, BankProvider provider) {
        if (code == null || !CODE_FORMAT.matcher(code).matches()) {
            throw new InvalidGrantException("Malformed authorization code");
        }
        String prefix = provider.getAuthorizationCodePrefix();
        if (prefix != null && !prefix.isBlank() && !code.startsWith(prefix)) {
            throw new InvalidGrantException("Authorization code does not belong to provider " + provider.getCode());
        }
    }
}
