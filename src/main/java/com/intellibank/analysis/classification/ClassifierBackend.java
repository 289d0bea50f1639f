package com.intellibank.analysis.classification;

/**
 * Pluggable decision function behind the learned provider.
 */
public interface ClassifierBackend {

    /**
     * @throws com.intellibank.analysis.exceptions.ClassifierUnavailableException when the backend
     *         cannot answer right now; the caller may retry
     */
    ClassifierVerdict classify(String merchantText, String description);
}
