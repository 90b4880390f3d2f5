package com.bank_sync_engine.openbanking.dto;

import java.util.List;

/** GET /accounts/{id}/transactions page. */
public record ObTransactionPage(
        List<ObTransaction> data,
        Links links,
        Meta meta
) {
    public record Links(String self, String next) {}

    public record Meta(Integer totalRecords, Integer totalPages) {}
}
