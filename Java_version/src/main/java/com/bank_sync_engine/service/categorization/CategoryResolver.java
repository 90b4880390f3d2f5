package com.bank_sync_engine.service.categorization;

import com.bank_sync_engine.model.Category;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Maps a free-text category name from a classifier onto a known category. */
public final class CategoryResolver {

    private CategoryResolver() {}

    /**
     * Exact name (case-insensitive) first, then the shortest category name containing the answer, then
     * the longest category name contained in the answer.
     */
    public static Optional<Category> resolve(String answer, List<Category> categories) {
        if (answer == null || answer.isBlank()) {
            return Optional.empty();
        }
        String wanted = answer.trim().toLowerCase(Locale.ROOT);
        Comparator<Category> order = Comparator
                .comparingInt((Category c) -> c.getName().length())
                .thenComparing(Category::getName);

        return categories.stream()
                .filter(c -> c.getName() != null && c.getName().toLowerCase(Locale.ROOT).equals(wanted))
                .min(order)
                .or(() -> categories.stream()
                        .filter(c -> c.getName() != null && c.getName().toLowerCase(Locale.ROOT).contains(wanted))
                        .min(order))
                .or(() -> categories.stream()
                        .filter(c -> c.getName() != null && wanted.contains(c.getName().toLowerCase(Locale.ROOT)))
                        .max(order));
    }
}
