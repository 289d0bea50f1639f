package com.intellibank.analysis.classification.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.intellibank.analysis.classification.Category;

public final class KeywordHeuristics {

    private KeywordHeuristics() {}

    /**
     * Keyword weight (0.0 to 1.0) towards a category. Keywords are loosely normalized
     * (lowercase, no accents, no punctuation).
     */
    private record CategoryKeywordWeight(Category category, String keyword, double weight) {
        public CategoryKeywordWeight {
            if (category == null) throw new IllegalArgumentException("category is required");
            if (keyword == null || keyword.isBlank()) throw new IllegalArgumentException("keyword is required");
            if (weight < 0.0 || weight > 1.0) throw new IllegalArgumentException("weight must be between 0.0 and 1.0");
        }
    }

    /**
     * category -> (keyword -> weight), insertion ordered so iteration is deterministic.
     */
    public static final Map<Category, Map<String, Double>> CATEGORY_KEYWORD_WEIGHTS;

    static {
        List<CategoryKeywordWeight> items = new ArrayList<>();

        // Food
        items.add(new CategoryKeywordWeight(Category.FOOD, "restaurant", 0.70));
        items.add(new CategoryKeywordWeight(Category.FOOD, "cafe", 0.60));
        items.add(new CategoryKeywordWeight(Category.FOOD, "coffee", 0.60));
        items.add(new CategoryKeywordWeight(Category.FOOD, "pizza", 0.70));
        items.add(new CategoryKeywordWeight(Category.FOOD, "burger", 0.70));
        items.add(new CategoryKeywordWeight(Category.FOOD, "grill", 0.50));
        items.add(new CategoryKeywordWeight(Category.FOOD, "bakery", 0.60));
        items.add(new CategoryKeywordWeight(Category.FOOD, "taqueria", 0.70));

        // Groceries
        items.add(new CategoryKeywordWeight(Category.GROCERIES, "grocery", 0.80));
        items.add(new CategoryKeywordWeight(Category.GROCERIES, "supermarket", 0.80));
        items.add(new CategoryKeywordWeight(Category.GROCERIES, "market", 0.40));
        items.add(new CategoryKeywordWeight(Category.GROCERIES, "foods", 0.30));

        // Transportation
        items.add(new CategoryKeywordWeight(Category.TRANSPORTATION, "uber", 0.80));
        items.add(new CategoryKeywordWeight(Category.TRANSPORTATION, "lyft", 0.90));
        items.add(new CategoryKeywordWeight(Category.TRANSPORTATION, "fuel", 0.60));
        items.add(new CategoryKeywordWeight(Category.TRANSPORTATION, "gas", 0.50));
        items.add(new CategoryKeywordWeight(Category.TRANSPORTATION, "parking", 0.70));
        items.add(new CategoryKeywordWeight(Category.TRANSPORTATION, "transit", 0.70));
        items.add(new CategoryKeywordWeight(Category.TRANSPORTATION, "toll", 0.60));

        // Entertainment
        items.add(new CategoryKeywordWeight(Category.ENTERTAINMENT, "cinema", 0.80));
        items.add(new CategoryKeywordWeight(Category.ENTERTAINMENT, "theater", 0.60));
        items.add(new CategoryKeywordWeight(Category.ENTERTAINMENT, "tickets", 0.50));
        items.add(new CategoryKeywordWeight(Category.ENTERTAINMENT, "streaming", 0.60));
        items.add(new CategoryKeywordWeight(Category.ENTERTAINMENT, "games", 0.50));

        // Shopping
        items.add(new CategoryKeywordWeight(Category.SHOPPING, "amazon", 0.70));
        items.add(new CategoryKeywordWeight(Category.SHOPPING, "store", 0.40));
        items.add(new CategoryKeywordWeight(Category.SHOPPING, "outlet", 0.50));
        items.add(new CategoryKeywordWeight(Category.SHOPPING, "apparel", 0.60));

        // Utilities
        items.add(new CategoryKeywordWeight(Category.UTILITIES, "electric", 0.80));
        items.add(new CategoryKeywordWeight(Category.UTILITIES, "energy", 0.60));
        items.add(new CategoryKeywordWeight(Category.UTILITIES, "water", 0.50));
        items.add(new CategoryKeywordWeight(Category.UTILITIES, "internet", 0.70));
        items.add(new CategoryKeywordWeight(Category.UTILITIES, "wireless", 0.60));
        items.add(new CategoryKeywordWeight(Category.UTILITIES, "utility", 0.80));

        // Housing
        items.add(new CategoryKeywordWeight(Category.HOUSING, "rent", 0.80));
        items.add(new CategoryKeywordWeight(Category.HOUSING, "mortgage", 0.90));
        items.add(new CategoryKeywordWeight(Category.HOUSING, "apartments", 0.60));

        // Health
        items.add(new CategoryKeywordWeight(Category.HEALTH, "pharmacy", 0.80));
        items.add(new CategoryKeywordWeight(Category.HEALTH, "clinic", 0.70));
        items.add(new CategoryKeywordWeight(Category.HEALTH, "hospital", 0.80));
        items.add(new CategoryKeywordWeight(Category.HEALTH, "dental", 0.80));
        items.add(new CategoryKeywordWeight(Category.HEALTH, "medical", 0.70));

        // Travel
        items.add(new CategoryKeywordWeight(Category.TRAVEL, "airlines", 0.90));
        items.add(new CategoryKeywordWeight(Category.TRAVEL, "hotel", 0.80));
        items.add(new CategoryKeywordWeight(Category.TRAVEL, "inn", 0.40));
        items.add(new CategoryKeywordWeight(Category.TRAVEL, "resort", 0.70));

        // Income
        items.add(new CategoryKeywordWeight(Category.INCOME, "payroll", 0.95));
        items.add(new CategoryKeywordWeight(Category.INCOME, "salary", 0.90));
        items.add(new CategoryKeywordWeight(Category.INCOME, "interest", 0.50));
        items.add(new CategoryKeywordWeight(Category.INCOME, "dividend", 0.70));

        // Transfers
        items.add(new CategoryKeywordWeight(Category.TRANSFERS, "transfer", 0.80));
        items.add(new CategoryKeywordWeight(Category.TRANSFERS, "xfer", 0.80));

        // Fees
        items.add(new CategoryKeywordWeight(Category.FEES, "fee", 0.80));
        items.add(new CategoryKeywordWeight(Category.FEES, "charge", 0.40));

        CATEGORY_KEYWORD_WEIGHTS = Collections.unmodifiableMap(buildCategoryMap(items));
    }

    private static Map<Category, Map<String, Double>> buildCategoryMap(List<CategoryKeywordWeight> items) {
        Map<Category, Map<String, Double>> byCategory = new LinkedHashMap<>();
        for (CategoryKeywordWeight item : items) {
            byCategory.computeIfAbsent(item.category(), k -> new LinkedHashMap<>()).put(item.keyword(), item.weight());
        }
        Map<Category, Map<String, Double>> immutable = new LinkedHashMap<>();
        for (Map.Entry<Category, Map<String, Double>> e : byCategory.entrySet()) {
            immutable.put(e.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(e.getValue())));
        }
        return immutable;
    }

    /**
     * Maps an accumulated keyword score to a confidence.
     */
    public static double confidenceFromScore(double score) {
        if (score >= 1.5) return 0.92;
        if (score >= 1.0) return 0.88;
        if (score >= 0.9) return 0.85;
        if (score >= 0.7) return 0.80;
        if (score >= 0.5) return 0.72;
        return 0.65;
    }
}
