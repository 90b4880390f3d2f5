package com.bank_sync_engine.dto;

import com.bank_sync_engine.model.BankConnection;
import com.bank_sync_engine.model.ConnectionStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

/** Connection as exposed over HTTP. Tokens never leave the service. */
@Builder
public record ConnectionResponse(
        UUID id,
        @JsonProperty("company_id") UUID companyId,
        @JsonProperty("provider_code") String providerCode,
        String agency,
        @JsonProperty("account_number") String accountNumber,
        ConnectionStatus status,
        @JsonProperty("status_message") String statusMessage,
        @JsonProperty("current_balance") BigDecimal currentBalance,
        @JsonProperty("available_balance") BigDecimal availableBalance,
        String currency,
        @JsonProperty("last_sync_at") OffsetDateTime lastSyncAt,
        @JsonProperty("token_expires_at") OffsetDateTime tokenExpiresAt,
        boolean active
) {
    public static ConnectionResponse from(BankConnection c) {
        return ConnectionResponse.builder()
                .id(c.getId())
                .companyId(c.getCompanyId())
                .providerCode(c.getProviderCode())
                .agency(c.getAgency())
                .accountNumber(c.getAccountNumber())
                .status(c.getStatus())
                .statusMessage(c.getStatusMessage())
                .currentBalance(c.getCurrentBalance())
                .availableBalance(c.getAvailableBalance())
                .currency(c.getCurrency())
                .lastSyncAt(c.getLastSyncAt())
                .tokenExpiresAt(c.getTokenExpiresAt())
                .active(Boolean.TRUE.equals(c.getActive()))
                .build();
    }
}
