package com.bank_sync_engine.repository;

import com.bank_sync_engine.model.TrainingExample;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import reactor.core.publisher.Mono;

import java.util.UUID;

public interface TrainingExampleRepository extends ReactiveCrudRepository<TrainingExample, UUID> {

    Mono<TrainingExample> findFirstByCompanyIdAndNormalizedDescriptionAndVerifiedTrueOrderByCreatedAtDesc(
            UUID companyId, String normalizedDescription);
}
