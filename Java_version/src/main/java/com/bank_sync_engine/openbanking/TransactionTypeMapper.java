package com.bank_sync_engine.openbanking;

import com.bank_sync_engine.model.TransactionType;

import java.util.Locale;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Fixed table from provider transaction codes to {@link TransactionType}. Unknown or missing codes
 * fall back to {@code CREDIT}/{@code DEBIT} by direction.
 */
public final class TransactionTypeMapper {

    private static final Map<String, TransactionType> CODES = Map.ofEntries(
            entry("PIX_RECEBIDO", TransactionType.PIX_IN),
            entry("PIX_CREDITO", TransactionType.PIX_IN),
            entry("PIX_ENVIADO", TransactionType.PIX_OUT),
            entry("PIX_DEBITO", TransactionType.PIX_OUT),
            entry("TED_RECEBIDO", TransactionType.TRANSFER_IN),
            entry("DOC_RECEBIDO", TransactionType.TRANSFER_IN),
            entry("TRANSFERENCIA_RECEBIDA", TransactionType.TRANSFER_IN),
            entry("TED_ENVIADO", TransactionType.TRANSFER_OUT),
            entry("DOC_ENVIADO", TransactionType.TRANSFER_OUT),
            entry("TRANSFERENCIA_ENVIADA", TransactionType.TRANSFER_OUT),
            entry("TARIFA", TransactionType.FEE),
            entry("TARIFA_BANCARIA", TransactionType.FEE),
            entry("RENDIMENTO", TransactionType.INTEREST),
            entry("JUROS", TransactionType.INTEREST),
            entry("ESTORNO", TransactionType.ADJUSTMENT),
            entry("AJUSTE", TransactionType.ADJUSTMENT),
            entry("COMPRA_CARTAO", TransactionType.DEBIT),
            entry("SAQUE", TransactionType.DEBIT),
            entry("BOLETO", TransactionType.DEBIT),
            entry("PAGAMENTO", TransactionType.DEBIT),
            entry("DEPOSITO", TransactionType.CREDIT)
    );

    private TransactionTypeMapper() {}

    public static TransactionType map(String providerCode, boolean credit) {
        if (providerCode != null) {
            TransactionType mapped = CODES.get(providerCode.trim().toUpperCase(Locale.ROOT));
            if (mapped != null) {
                return mapped;
            }
        }
        return credit ? TransactionType.CREDIT : TransactionType.DEBIT;
    }
}
