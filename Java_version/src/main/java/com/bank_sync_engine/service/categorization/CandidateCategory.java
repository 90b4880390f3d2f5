package com.bank_sync_engine.service.categorization;

import com.bank_sync_engine.model.CategoryType;

import java.util.List;
import java.util.UUID;

public record CandidateCategory(UUID id, String name, CategoryType type, List<String> keywords) {}
