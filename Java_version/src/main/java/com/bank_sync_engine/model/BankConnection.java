package com.bank_sync_engine.model;

import com.bank_sync_engine.vault.EncryptedToken;
import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A company's authorized link to one bank account. Rows are soft-disabled through
 * {@code active}, never deleted.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("bank_connections")
public class BankConnection {

    @Id
    private UUID id;

    @Column("company_id")
    private UUID companyId;

    @Column("provider_code")
    private String providerCode;

    @Column("agency")
    private String agency;

    @Column("account_number")
    private String accountNumber;

    @Column("account_type")
    private String accountType;   // 'checking', 'savings', 'business', 'digital'

    // Provider-side account id, learned on the first account fetch
    @Column("external_account_id")
    private String externalAccountId;

    // Sensitive: ciphertext only, see CredentialVault
    @Column("access_token")
    private String accessTokenCiphertext;

    @Column("refresh_token")
    private String refreshTokenCiphertext;

    @Column("token_expires_at")
    private OffsetDateTime tokenExpiresAt;

    @Column("status")
    private ConnectionStatus status;

    @Column("status_message")
    private String statusMessage;

    @Column("current_balance")
    private BigDecimal currentBalance;

    @Column("available_balance")
    private BigDecimal availableBalance;

    @Column("currency")
    private String currency;

    @Column("last_sync_at")
    private OffsetDateTime lastSyncAt;

    @Column("sync_frequency_hours")
    private Integer syncFrequencyHours;

    @Column("is_active")
    private Boolean active;

    @Column("created_at")
    private OffsetDateTime createdAt;

    @Column("updated_at")
    private OffsetDateTime updatedAt;

    public EncryptedToken encryptedAccessToken() {
        return EncryptedToken.of(accessTokenCiphertext);
    }

    public EncryptedToken encryptedRefreshToken() {
        return EncryptedToken.of(refreshTokenCiphertext);
    }

    public boolean tokenExpiresWithin(OffsetDateTime now, Duration skew) {
        return tokenExpiresAt == null || !tokenExpiresAt.isAfter(now.plus(skew));
    }
}
