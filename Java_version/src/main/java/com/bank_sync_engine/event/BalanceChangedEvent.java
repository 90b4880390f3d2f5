package com.bank_sync_engine.event;

import java.math.BigDecimal;
import java.util.UUID;

public record BalanceChangedEvent(
        UUID connectionId,
        UUID companyId,
        BigDecimal previousBalance,
        BigDecimal currentBalance,
        BigDecimal availableBalance,
        String currency
) implements SyncEvent {}
