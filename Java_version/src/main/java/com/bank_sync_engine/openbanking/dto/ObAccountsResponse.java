package com.bank_sync_engine.openbanking.dto;

import java.util.List;

/** GET /accounts response, minimal. */
public record ObAccountsResponse(
        List<Account> data
) {
    public record Account(
            String accountId,
            String accountType,     // e.g. "checking", "savings"
            String compeCode,
            String branchCode,
            String number,
            String checkDigit,
            String currency,
            String balance,
            String availableBalance,
            String status
    ) {}
}
