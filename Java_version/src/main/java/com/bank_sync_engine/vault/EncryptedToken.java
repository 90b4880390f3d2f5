package com.bank_sync_engine.vault;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

/**
 * An OAuth token at rest: base64(iv || AES-GCM ciphertext). Holding one never decrypts anything;
 * callers must {@link #reveal(SecretKey)} explicitly.
 */
public record EncryptedToken(String ciphertext) {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12;
    private static final int GCM_TAG_LENGTH = 16;
    private static final SecureRandom RANDOM = new SecureRandom();

    public EncryptedToken {
        if (ciphertext == null || ciphertext.isBlank()) {
            throw new IllegalArgumentException("ciphertext must not be blank");
        }
    }

    /** Wraps a stored column value, {@code null} when nothing is stored. */
    public static EncryptedToken of(String storedCiphertext) {
        return storedCiphertext == null || storedCiphertext.isBlank() ? null : new EncryptedToken(storedCiphertext);
    }

    public static EncryptedToken seal(String plaintext, SecretKey key) {
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            RANDOM.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
            byte[] cipherText = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            byte[] withIv = new byte[iv.length + cipherText.length];
            System.arraycopy(iv, 0, withIv, 0, iv.length);
            System.arraycopy(cipherText, 0, withIv, iv.length, cipherText.length);
            return new EncryptedToken(Base64.getEncoder().encodeToString(withIv));
        } catch (GeneralSecurityException e) {
            throw new VaultException("Token encryption failed", e);
        }
    }

    public String reveal(SecretKey key) {
        try {
            byte[] withIv = Base64.getDecoder().decode(ciphertext);
            if (withIv.length <= GCM_IV_LENGTH) {
                throw new VaultException("Ciphertext too short", null);
            }
            byte[] iv = Arrays.copyOfRange(withIv, 0, GCM_IV_LENGTH);
            byte[] cipherText = Arrays.copyOfRange(withIv, GCM_IV_LENGTH, withIv.length);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
            return new String(cipher.doFinal(cipherText), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new VaultException("Token decryption failed", e);
        }
    }

    @Override
    public String toString() {
        return "EncryptedToken[***]";
    }
}
