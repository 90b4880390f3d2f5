package com.bank_sync_engine.controller;

import com.bank_sync_engine.dto.*;
import com.bank_sync_engine.service.categorization.BulkCategorizationService;
import com.bank_sync_engine.service.categorization.CategorizationPipeline;
import com.bank_sync_engine.service.categorization.CategoryRuleService;
import com.bank_sync_engine.service.feedback.CategorizationAccuracyService;
import com.bank_sync_engine.service.feedback.FeedbackLearner;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1")
public class CategorizationController {

    private final CategorizationPipeline pipeline;

    private final BulkCategorizationService bulkCategorizationService;

    private final CategoryRuleService ruleService;

    private final FeedbackLearner feedbackLearner;

    private final CategorizationAccuracyService accuracyService;

    private final Clock clock;

    @PostMapping("/transactions/{transactionId}/categorize")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<CategorizationResult>> categorize(@PathVariable UUID transactionId) {
        return pipeline.categorize(transactionId)
                .map(ApiResponse::ok);
    }

    @PostMapping("/transactions/{transactionId}/correction")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<CorrectionResponse>> correct(@PathVariable UUID transactionId,
                                                         @Valid @RequestBody CorrectionRequest request) {
        return feedbackLearner.recordCorrection(transactionId, request.categoryId(), request.reviewerId())
                .map(ApiResponse::ok);
    }

    @PostMapping("/companies/{companyId}/categorize")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<BulkCategorizationResult>> categorizeUncategorized(
            @PathVariable UUID companyId,
            @RequestParam(name = "limit", defaultValue = "100") @Min(1) @Max(1000) int limit) {
        return bulkCategorizationService.categorizeUncategorized(companyId, limit)
                .map(ApiResponse::ok);
    }

    @PostMapping("/companies/{companyId}/recategorize")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<BulkCategorizationResult>> recategorizeLowConfidence(
            @PathVariable UUID companyId,
            @RequestParam(name = "threshold", defaultValue = "0.5") double threshold,
            @RequestParam(name = "limit", defaultValue = "100") @Min(1) @Max(1000) int limit) {
        return bulkCategorizationService.recategorizeLowConfidence(companyId, threshold, limit)
                .map(ApiResponse::ok);
    }

    @PostMapping("/companies/{companyId}/rules")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ApiResponse<RuleResponse>> createRule(@PathVariable UUID companyId,
                                                      @Valid @RequestBody CreateRuleRequest request) {
        return ruleService.createRule(companyId, request)
                .map(RuleResponse::from)
                .map(ApiResponse::ok);
    }

    @GetMapping("/companies/{companyId}/rules")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<List<RuleResponse>>> listRules(@PathVariable UUID companyId) {
        return ruleService.listRules(companyId)
                .map(RuleResponse::from)
                .collectList()
                .map(ApiResponse::ok);
    }

    @PostMapping("/companies/{companyId}/rules/{ruleId}/apply")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<RuleApplicationResult>> applyRule(
            @PathVariable UUID companyId,
            @PathVariable UUID ruleId,
            @RequestParam(name = "limit", defaultValue = "500") @Min(1) @Max(5000) int limit) {
        return bulkCategorizationService.applyRule(companyId, ruleId, limit)
                .map(ApiResponse::ok);
    }

    @GetMapping("/companies/{companyId}/rules/suggestions")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<List<RuleSuggestion>>> suggestRules(@PathVariable UUID companyId) {
        return ruleService.suggestRules(companyId)
                .collectList()
                .map(ApiResponse::ok);
    }

    /** Defaults to the last 30 days. */
    @GetMapping("/companies/{companyId}/accuracy")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<AccuracyReport>> accuracy(
            @PathVariable UUID companyId,
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime to) {
        OffsetDateTime end = to != null ? to : OffsetDateTime.now(clock);
        OffsetDateTime start = from != null ? from : end.minusDays(30);
        return accuracyService.report(companyId, start, end)
                .map(ApiResponse::ok);
    }

    @PostMapping("/accuracy/recompute")
    @ResponseStatus(HttpStatus.OK)
    public Mono<ApiResponse<CategorizationAccuracyService.RecomputeSummary>> recomputeAccuracy() {
        return accuracyService.recomputeAccuracy()
                .map(ApiResponse::ok);
    }
}
