package com.bank_sync_engine.openbanking.sandbox;

import com.bank_sync_engine.exception.ValidationException;
import com.bank_sync_engine.model.BankConnection;
import com.bank_sync_engine.openbanking.AccountGateway;
import com.bank_sync_engine.openbanking.AccountInfo;
import com.bank_sync_engine.openbanking.ProviderTransactionMapper;
import com.bank_sync_engine.openbanking.RawTransaction;
import com.bank_sync_engine.openbanking.dto.ObAccountsResponse;
import com.bank_sync_engine.openbanking.dto.ObTransactionPage;
import com.bank_sync_engine.vault.CredentialVault;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * Same paging and type mapping as the production gateway, with {@link SandboxBank} answering
 * instead of HTTP.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "open-banking", name = "mode", havingValue = "sandbox", matchIfMissing = true)
public class SandboxAccountGateway implements AccountGateway {

    private final SandboxBank bank;
    private final CredentialVault vault;
    private final Clock clock;

    @Override
    public Mono<AccountInfo> getAccountInfo(BankConnection connection) {
        return Mono.fromCallable(() -> {
            String token = vault.usableAccessToken(connection, OffsetDateTime.now(clock));
            ObAccountsResponse.Account account = bank.accounts(token, connection.getProviderCode()).data().get(0);
            return new AccountInfo(account.accountId(), account.accountType(),
                    new BigDecimal(account.balance()), new BigDecimal(account.availableBalance()),
                    account.currency(), account.status());
        });
    }

    @Override
    public Flux<RawTransaction> getTransactions(BankConnection connection, LocalDate from, LocalDate to) {
        return Flux.defer(() -> {
            String token = vault.usableAccessToken(connection, OffsetDateTime.now(clock));
            if (connection.getExternalAccountId() == null) {
                return Flux.error(new ValidationException(
                        "Connection " + connection.getId() + " has no provider account id yet"));
            }
            return fetch(token, connection, from, to, 1)
                    .expand(page -> page.hasNext()
                            ? fetch(token, connection, from, to, page.number() + 1)
                            : Mono.empty())
                    .concatMapIterable(page -> page.body().data())
                    .map(ProviderTransactionMapper::toRaw);
        });
    }

    private record Page(int number, ObTransactionPage body) {
        boolean hasNext() {
            return body.meta() != null && body.meta().totalPages() != null && number < body.meta().totalPages();
        }
    }

    private Mono<Page> fetch(String token, BankConnection connection, LocalDate from, LocalDate to, int page) {
        return Mono.fromCallable(() -> new Page(page, bank.transactions(token, connection.getProviderCode(),
                connection.getExternalAccountId(), from, to, page)));
    }
}
