package com.bank_sync_engine.service.feedback;

import com.bank_sync_engine.dto.CorrectionResponse;
import com.bank_sync_engine.exception.ResourceNotFoundException;
import com.bank_sync_engine.model.CanonicalTransaction;
import com.bank_sync_engine.model.CategorizationDecision;
import com.bank_sync_engine.model.CategorizationMethod;
import com.bank_sync_engine.model.TrainingExample;
import com.bank_sync_engine.repository.CategorizationDecisionRepository;
import com.bank_sync_engine.repository.CategoryRepository;
import com.bank_sync_engine.repository.TrainingExampleRepository;
import com.bank_sync_engine.repository.TransactionRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Turns a user's category correction into a verified training example and closes the loop on the
 * latest automatic decision for the transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeedbackLearner {

    static final String VERIFICATION_SOURCE = "user_feedback";

    private final TransactionRepository transactionRepository;
    private final CategoryRepository categoryRepository;
    private final CategorizationDecisionRepository decisionRepository;
    private final TrainingExampleRepository trainingExampleRepository;
    private final TransactionalOperator transactionalOperator;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Records that {@code categoryId} is the right category for the transaction. The transaction is
     * marked as reviewed, so the pipeline never touches it again.
     */
    public Mono<CorrectionResponse> recordCorrection(UUID transactionId, UUID categoryId, UUID reviewerId) {
        return transactionRepository.findById(transactionId)
                .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Transaction", transactionId)))
                .flatMap(transaction -> categoryRepository.findAvailableForCompany(transaction.getCompanyId())
                        .filter(c -> c.getId().equals(categoryId))
                        .next()
                        .switchIfEmpty(Mono.error(() -> new ResourceNotFoundException("Category", categoryId)))
                        .flatMap(category -> applyCorrection(transaction, categoryId, reviewerId)))
                .doOnNext(r -> log.info("Transaction {} corrected to category {} (previous {}, accepted={})",
                        r.transactionId(), r.categoryId(), r.previousCategoryId(), r.wasAccepted()));
    }

    private Mono<CorrectionResponse> applyCorrection(CanonicalTransaction transaction, UUID categoryId, UUID reviewerId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        TrainingExample example = TrainingExample.builder()
                .companyId(transaction.getCompanyId())
                .transactionId(transaction.getId())
                .description(transaction.getDescription())
                .normalizedDescription(FeatureExtractor.normalizeDescription(transaction.getDescription()))
                .amount(transaction.getAmount())
                .transactionType(transaction.getTransactionType())
                .counterpartName(transaction.getCounterpartName())
                .categoryId(categoryId)
                .verified(true)
                .verificationSource(VERIFICATION_SOURCE)
                .verifiedBy(reviewerId)
                .features(writeFeatures(transaction))
                .createdAt(now)
                .build();

        return trainingExampleRepository.save(example)
                .flatMap(saved -> transactionRepository.applyManualReview(transaction.getId(), categoryId, now)
                        .then(reviewLatestDecision(transaction, categoryId, now))
                        .map(accepted -> CorrectionResponse.builder()
                                .transactionId(transaction.getId())
                                .previousCategoryId(transaction.getCategoryId())
                                .categoryId(categoryId)
                                .wasAccepted(accepted)
                                .trainingExampleId(saved.getId())
                                .build()))
                .as(transactionalOperator::transactional);
    }

    /**
     * Marks the newest decision as accepted when it suggested the chosen category. With no decision
     * on record, a manual one is logged instead.
     */
    private Mono<Boolean> reviewLatestDecision(CanonicalTransaction transaction, UUID categoryId, OffsetDateTime now) {
        return decisionRepository.findFirstByTransactionIdOrderByCreatedAtDesc(transaction.getId())
                .flatMap(decision -> {
                    boolean accepted = categoryId.equals(decision.getSuggestedCategoryId());
                    return decisionRepository.recordReview(decision.getId(), accepted, categoryId)
                            .thenReturn(accepted);
                })
                .switchIfEmpty(Mono.defer(() -> decisionRepository.save(CategorizationDecision.builder()
                                .transactionId(transaction.getId())
                                .companyId(transaction.getCompanyId())
                                .method(CategorizationMethod.MANUAL)
                                .suggestedCategoryId(categoryId)
                                .confidence(1.0)
                                .reason("manual review")
                                .processingTimeMs(0L)
                                .wasAccepted(true)
                                .finalCategoryId(categoryId)
                                .createdAt(now)
                                .build())
                        .thenReturn(true)));
    }

    private String writeFeatures(CanonicalTransaction transaction) {
        try {
            return objectMapper.writeValueAsString(FeatureExtractor.extract(transaction));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize training features", e);
        }
    }
}
