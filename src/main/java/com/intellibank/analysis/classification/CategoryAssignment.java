package com.intellibank.analysis.classification;

/**
 * @param source name of the provider that decided, or {@code fallback}
 */
public record CategoryAssignment(Category category, double confidence, String source) {

    public static final String FALLBACK_SOURCE = "fallback";

    public CategoryAssignment {
        if (category == null) throw new IllegalArgumentException("category is required");
        if (confidence < 0.0 || confidence > 1.0) throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
    }

    public static CategoryAssignment uncategorized() {
        return new CategoryAssignment(Category.UNCATEGORIZED, 0.0, FALLBACK_SOURCE);
    }
}
