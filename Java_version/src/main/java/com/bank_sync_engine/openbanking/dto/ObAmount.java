package com.bank_sync_engine.openbanking.dto;

/** Provider monetary value. {@code amount} is a decimal string in major units. */
public record ObAmount(
        String amount,
        String currency
) {}
