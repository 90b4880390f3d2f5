package com.bank_sync_engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RuleType {
    KEYWORD,
    AMOUNT_RANGE,
    COUNTERPART,
    PATTERN;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }
}
