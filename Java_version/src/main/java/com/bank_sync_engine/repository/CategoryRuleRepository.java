package com.bank_sync_engine.repository;

import com.bank_sync_engine.model.CategoryRule;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

public interface CategoryRuleRepository extends ReactiveCrudRepository<CategoryRule, UUID> {

    Flux<CategoryRule> findByCompanyIdAndActiveTrue(UUID companyId);

    Flux<CategoryRule> findByCompanyId(UUID companyId);

    @Modifying
    @Query("UPDATE category_rules SET match_count = match_count + :delta WHERE id = :id")
    Mono<Integer> incrementMatchCount(UUID id, int delta);

    @Modifying
    @Query("UPDATE category_rules SET accuracy_rate = :accuracy WHERE id = :id")
    Mono<Integer> updateAccuracy(UUID id, double accuracy);
}
