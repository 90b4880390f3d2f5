package com.bank_sync_engine.service;

import com.bank_sync_engine.exception.ValidationException;

import java.util.Locale;
import java.util.regex.Pattern;

/** Brazilian branch (agency) and account number formats, checked before anything is persisted. */
public final class AccountNumberValidator {

    private static final Pattern AGENCY = Pattern.compile("\\d{4}");
    // 1-12 digits, optional check digit (digit or X), optionally separated by '-'
    private static final Pattern ACCOUNT = Pattern.compile("\\d{1,12}(-?[0-9Xx])?");

    private AccountNumberValidator() {}

    public static void validate(String agency, String accountNumber) {
        if (agency == null || !AGENCY.matcher(agency.trim()).matches()) {
            throw new ValidationException("Invalid agency '" + agency + "': expected 4 digits");
        }
        if (accountNumber == null || !ACCOUNT.matcher(accountNumber.trim()).matches()) {
            throw new ValidationException("Invalid account number '" + accountNumber
                    + "': expected up to 12 digits and an optional check digit");
        }
    }

    /** Storage form: trimmed, check digit upper case. */
    public static String normalizeAccountNumber(String accountNumber) {
        return accountNumber.trim().toUpperCase(Locale.ROOT);
    }
}
