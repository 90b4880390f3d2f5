package com.bank_sync_engine.openbanking;

import com.bank_sync_engine.config.OpenBankingProperties;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.List;

public final class AuthorizationUrls {

    private AuthorizationUrls() {}

    public static String build(String authorizationEndpoint, OpenBankingProperties props, List<String> permissions,
                        String consentId, String state, String nonce) {
        List<String> scopes = (permissions == null || permissions.isEmpty()) ? props.getScopes() : permissions;
        return UriComponentsBuilder.fromHttpUrl(authorizationEndpoint)
                .queryParam("response_type", "code")
                .queryParam("client_id", props.getClientId())
                .queryParam("scope", String.join(" ", scopes))
                .queryParam("redirect_uri", props.getRedirectUri())
                .queryParam("consent_id", consentId)
                .queryParam("state", state)
                .queryParam("nonce", nonce)
                .encode()
                .toUriString();
    }
}
