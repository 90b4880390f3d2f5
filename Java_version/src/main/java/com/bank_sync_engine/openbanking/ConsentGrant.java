package com.bank_sync_engine.openbanking;

public record ConsentGrant(
        String consentId,
        String authorizationUrl,
        String state,
        String nonce,
        long expiresIn
) {}
