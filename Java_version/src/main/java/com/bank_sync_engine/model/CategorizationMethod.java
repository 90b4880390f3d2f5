package com.bank_sync_engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CategorizationMethod {
    RULE,
    CLASSIFIER,
    DEFAULT,
    MANUAL;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase();
    }
}
