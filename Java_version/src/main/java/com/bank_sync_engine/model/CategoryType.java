package com.bank_sync_engine.model;

public enum CategoryType {
    INCOME,
    EXPENSE,
    TRANSFER
}
