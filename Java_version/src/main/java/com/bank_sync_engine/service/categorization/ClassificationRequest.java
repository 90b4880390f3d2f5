package com.bank_sync_engine.service.categorization;

import com.bank_sync_engine.model.TransactionType;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/** Feature summary of one transaction plus the categories a classifier may choose from. */
public record ClassificationRequest(
        UUID companyId,
        String description,
        BigDecimal amount,
        TransactionType type,
        String counterpartName,
        OffsetDateTime occurredAt,
        List<CandidateCategory> candidates
) {}
