package com.intellibank.analysis.classification;

/**
 * Raw answer of a {@link ClassifierBackend}. The label may be unknown to the catalog.
 */
public record ClassifierVerdict(String label, double confidence) {

    private static final ClassifierVerdict NONE = new ClassifierVerdict(null, 0.0);

    public ClassifierVerdict {
        if (Double.isNaN(confidence)) confidence = 0.0;
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public static ClassifierVerdict none() {
        return NONE;
    }

    public boolean isEmpty() {
        return label == null || label.isBlank() || confidence <= 0.0;
    }
}
