package com.bank_sync_engine.repository;

import com.bank_sync_engine.model.Category;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

public interface CategoryRepository extends ReactiveCrudRepository<Category, UUID> {

    /** System categories plus the company's own, active only. */
    @Query("""
            SELECT * FROM categories
             WHERE is_active = TRUE
               AND (is_system = TRUE OR company_id = :companyId)
             ORDER BY name
            """)
    Flux<Category> findAvailableForCompany(UUID companyId);

    Mono<Category> findBySlugAndSystemTrue(String slug);

    @Modifying
    @Query("UPDATE categories SET accuracy_rate = :accuracy WHERE id = :id")
    Mono<Integer> updateAccuracy(UUID id, double accuracy);
}
