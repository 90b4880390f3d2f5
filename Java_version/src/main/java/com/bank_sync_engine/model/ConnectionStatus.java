package com.bank_sync_engine.model;

public enum ConnectionStatus {
    PENDING,
    ACTIVE,
    ERROR,
    EXPIRED
}
