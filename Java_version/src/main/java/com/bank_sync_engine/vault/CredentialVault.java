package com.bank_sync_engine.vault;

import com.bank_sync_engine.config.VaultProperties;
import com.bank_sync_engine.exception.AuthException;
import com.bank_sync_engine.model.BankConnection;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.time.OffsetDateTime;
import java.util.Base64;

/**
 * Seals and reveals the OAuth tokens stored on {@link BankConnection}. No business logic.
 */
@Component
public class CredentialVault {

    private final SecretKey key;

    public CredentialVault(VaultProperties props) {
        byte[] raw = Base64.getDecoder().decode(props.getMasterKey());
        if (raw.length != 32) {
            throw new IllegalStateException("vault.master-key must be a base64 encoded 256-bit key");
        }
        this.key = new SecretKeySpec(raw, "AES");
    }

    public EncryptedToken seal(String plaintext) {
        return EncryptedToken.seal(plaintext, key);
    }

    public String reveal(EncryptedToken token) {
        return token.reveal(key);
    }

    /** Copy of the connection carrying the sealed tokens and their expiry. */
    public BankConnection storeTokens(BankConnection connection, TokenSet tokens, OffsetDateTime now) {
        BankConnection.BankConnectionBuilder builder = connection.toBuilder()
                .accessTokenCiphertext(seal(tokens.accessToken()).ciphertext())
                .tokenExpiresAt(now.plusSeconds(tokens.expiresIn()));
        // some providers do not rotate the refresh token
        if (tokens.refreshToken() != null && !tokens.refreshToken().isBlank()) {
            builder.refreshTokenCiphertext(seal(tokens.refreshToken()).ciphertext());
        }
        return builder.build();
    }

    public String accessToken(BankConnection connection) {
        EncryptedToken token = connection.encryptedAccessToken();
        if (token == null) {
            throw new AuthException("Connection " + connection.getId() + " has no access token");
        }
        return reveal(token);
    }

    /**
     * Access token of a connection whose token is still valid at {@code now}. Gateways call this
     * instead of {@link #accessToken} so an expired token surfaces as an auth error before any
     * network round-trip.
     */
    public String usableAccessToken(BankConnection connection, OffsetDateTime now) {
        if (connection.getTokenExpiresAt() != null && !connection.getTokenExpiresAt().isAfter(now)) {
            throw new AuthException("Access token of connection " + connection.getId() + " expired");
        }
        return accessToken(connection);
    }

    public String refreshToken(BankConnection connection) {
        EncryptedToken token = connection.encryptedRefreshToken();
        if (token == null) {
            throw new AuthException("Connection " + connection.getId() + " has no refresh token");
        }
        return reveal(token);
    }
}
