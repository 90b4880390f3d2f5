package com.bank_sync_engine.openbanking;

import com.bank_sync_engine.exception.ProviderNotFoundException;
import com.bank_sync_engine.model.BankProvider;
import com.bank_sync_engine.repository.BankProviderRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
@RequiredArgsConstructor
public class ProviderRegistry {

    private final BankProviderRepository bankProviderRepository;

    /** Active provider for {@code code}, or {@link ProviderNotFoundException}. */
    public Mono<BankProvider> require(String code) {
        return bankProviderRepository.findByCode(code)
                .filter(p -> Boolean.TRUE.equals(p.getActive()))
                .switchIfEmpty(Mono.error(() -> new ProviderNotFoundException(code)));
    }
}
