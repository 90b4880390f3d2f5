package com.bank_sync_engine.repository;

import com.bank_sync_engine.model.BankProvider;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Mono;

import java.util.UUID;

public interface BankProviderRepository extends ReactiveCrudRepository<BankProvider, UUID> {
    Mono<BankProvider> findByCode(String code);
}
