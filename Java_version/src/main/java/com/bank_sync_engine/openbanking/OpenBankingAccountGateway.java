package com.bank_sync_engine.openbanking;

import com.bank_sync_engine.exception.ProviderUnavailableException;
import com.bank_sync_engine.exception.ValidationException;
import com.bank_sync_engine.model.BankConnection;
import com.bank_sync_engine.model.BankProvider;
import com.bank_sync_engine.openbanking.dto.ObAccountsResponse;
import com.bank_sync_engine.openbanking.dto.ObTransactionPage;
import com.bank_sync_engine.vault.CredentialVault;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "open-banking", name = "mode", havingValue = "production")
public class OpenBankingAccountGateway implements AccountGateway {

    static final String INTERACTION_ID_HEADER = "x-fapi-interaction-id";

    private final WebClient webClient;
    private final ProviderRegistry providerRegistry;
    private final CredentialVault vault;
    private final Clock clock;

    public OpenBankingAccountGateway(@Qualifier("openBankingWebClient") WebClient webClient,
                                     ProviderRegistry providerRegistry,
                                     CredentialVault vault,
                                     Clock clock) {
        this.webClient = webClient;
        this.providerRegistry = providerRegistry;
        this.vault = vault;
        this.clock = clock;
    }

    @Override
    public Mono<AccountInfo> getAccountInfo(BankConnection connection) {
        return Mono.defer(() -> {
            String token = vault.usableAccessToken(connection, OffsetDateTime.now(clock));
            return providerRegistry.require(connection.getProviderCode())
                    .flatMap(provider -> webClient.get()
                            .uri(provider.getApiBaseUrl() + "/accounts")
                            .headers(h -> {
                                h.setBearerAuth(token);
                                h.set(INTERACTION_ID_HEADER, UUID.randomUUID().toString());
                            })
                            .retrieve()
                            .bodyToMono(ObAccountsResponse.class)
                            .onErrorMap(e -> ProviderErrorTranslator.translate(e, "Account fetch")))
                    .map(response -> toAccountInfo(pickAccount(response, connection)));
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
            return providerRegistry.require(connection.getProviderCode())
                    .flatMapMany(provider -> {
                        URI first = firstPage(provider, connection.getExternalAccountId(), from, to);
                        return fetchPage(first, 1, token)
                                .expand(page -> nextPage(page, token))
                                .concatMapIterable(page -> Optional.ofNullable(page.body().data()).orElse(List.of()));
                    })
                    .map(ProviderTransactionMapper::toRaw);
        });
    }

    private record FetchedPage(URI uri, int number, ObTransactionPage body) {}

    private Mono<FetchedPage> fetchPage(URI uri, int number, String token) {
        return webClient.get()
                .uri(uri)
                .headers(h -> {
                    h.setBearerAuth(token);
                    h.set(INTERACTION_ID_HEADER, UUID.randomUUID().toString());
                })
                .retrieve()
                .bodyToMono(ObTransactionPage.class)
                .onErrorMap(e -> ProviderErrorTranslator.translate(e, "Transaction fetch"))
                .map(body -> new FetchedPage(uri, number, body));
    }

    // links.next wins; otherwise meta.totalPages drives the page parameter
    private Mono<FetchedPage> nextPage(FetchedPage page, String token) {
        ObTransactionPage body = page.body();
        if (body.links() != null && body.links().next() != null && !body.links().next().isBlank()) {
            URI next = URI.create(body.links().next());
            if (next.equals(page.uri())) {
                return Mono.empty();
            }
            return fetchPage(next, page.number() + 1, token);
        }
        Integer totalPages = body.meta() != null ? body.meta().totalPages() : null;
        if (totalPages != null && page.number() < totalPages) {
            URI next = UriComponentsBuilder.fromUri(page.uri())
                    .replaceQueryParam("page", page.number() + 1)
                    .build(true)
                    .toUri();
            return fetchPage(next, page.number() + 1, token);
        }
        return Mono.empty();
    }

    private static URI firstPage(BankProvider provider, String accountId, LocalDate from, LocalDate to) {
        return UriComponentsBuilder.fromHttpUrl(provider.getApiBaseUrl())
                .path("/accounts/{accountId}/transactions")
                .queryParam("fromBookingDate", from)
                .queryParam("toBookingDate", to)
                .queryParam("page", 1)
                .buildAndExpand(accountId)
                .encode()
                .toUri();
    }

    static ObAccountsResponse.Account pickAccount(ObAccountsResponse response, BankConnection connection) {
        List<ObAccountsResponse.Account> accounts = Optional.ofNullable(response.data()).orElse(List.of());
        if (accounts.isEmpty()) {
            throw new ProviderUnavailableException("Provider returned no accounts for connection "
                    + connection.getId(), false, null);
        }
        return accounts.stream()
                .filter(a -> a.accountId() != null && a.accountId().equals(connection.getExternalAccountId()))
                .findFirst()
                .or(() -> accounts.stream()
                        .filter(a -> a.number() != null && connection.getAccountNumber() != null
                                && connection.getAccountNumber().startsWith(a.number()))
                        .findFirst())
                .orElse(accounts.get(0));
    }

    static AccountInfo toAccountInfo(ObAccountsResponse.Account account) {
        return new AccountInfo(
                account.accountId(),
                account.accountType(),
                decimal(account.balance()),
                decimal(account.availableBalance()),
                account.currency() != null ? account.currency() : "BRL",
                account.status()
        );
    }

    private static BigDecimal decimal(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Unparsable balance '{}'", value);
            return null;
        }
    }
}
