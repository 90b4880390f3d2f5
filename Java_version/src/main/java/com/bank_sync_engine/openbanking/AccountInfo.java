package com.bank_sync_engine.openbanking;

import java.math.BigDecimal;

/** Balances in major units, as the provider reports them. */
public record AccountInfo(
        String externalAccountId,
        String accountType,
        BigDecimal balance,
        BigDecimal availableBalance,
        String currency,
        String status
) {}
