package com.bank_sync_engine.repository;

import com.bank_sync_engine.model.CanonicalTransaction;
import lombok.RequiredArgsConstructor;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.relational.core.query.Update;
import reactor.core.publisher.Mono;

import static org.springframework.data.relational.core.query.Criteria.where;
import static org.springframework.data.relational.core.query.Query.query;

@RequiredArgsConstructor
class TransactionProviderFieldsUpdaterImpl implements TransactionProviderFieldsUpdater {

    private final R2dbcEntityTemplate template;

    @Override
    public Mono<Long> updateProviderFields(CanonicalTransaction t) {
        Update update = Update.update("transactionType", t.getTransactionType())
                .set("amount", t.getAmount())
                .set("currency", t.getCurrency())
                .set("description", t.getDescription())
                .set("occurredAt", t.getOccurredAt())
                .set("counterpartName", t.getCounterpartName())
                .set("counterpartDocument", t.getCounterpartDocument())
                .set("referenceNumber", t.getReferenceNumber())
                .set("balanceAfter", t.getBalanceAfter())
                .set("status", t.getStatus())
                .set("updatedAt", t.getUpdatedAt());
        return template.update(query(where("id").is(t.getId())), update, CanonicalTransaction.class);
    }
}
