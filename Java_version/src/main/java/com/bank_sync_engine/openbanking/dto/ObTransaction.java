package com.bank_sync_engine.openbanking.dto;

public record ObTransaction(
        String transactionId,
        String type,                    // provider code, e.g. "PIX_RECEBIDO"
        String creditDebitType,         // "CREDIT" | "DEBIT"
        ObAmount amount,
        String bookingDateTime,
        String transactionName,
        String creditorName,
        String debtorName,
        String partieDocument,
        String remittanceInformation,
        String proprietaryBankTransactionCode,
        ObAmount balanceAfterTransaction,
        String completedAuthorisedPaymentType
) {}
