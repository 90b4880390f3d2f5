package com.bank_sync_engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TransactionType {
    DEBIT,
    CREDIT,
    TRANSFER_IN,
    TRANSFER_OUT,
    PIX_IN,
    PIX_OUT,
    FEE,
    INTEREST,
    ADJUSTMENT;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }
}
