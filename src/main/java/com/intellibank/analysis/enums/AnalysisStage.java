package com.intellibank.analysis.enums;

/**
 * Pipeline stages of an analysis job, in execution order.
 * Transitions only move forward; FAILED is reachable from every non-terminal stage.
 */
public enum AnalysisStage {
    CREATED,
    EXTRACTING,
    NORMALIZING,
    CATEGORIZING,
    DETECTING_ANOMALIES,
    AGGREGATING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Stages that talk to external dependencies and may be retried on transient failures.
     */
    public boolean isRetryable() {
        return this == EXTRACTING || this == CATEGORIZING;
    }

    public AnalysisStage next() {
        return switch (this) {
            case CREATED -> EXTRACTING;
            case EXTRACTING -> NORMALIZING;
            case NORMALIZING -> CATEGORIZING;
            case CATEGORIZING -> DETECTING_ANOMALIES;
            case DETECTING_ANOMALIES -> AGGREGATING;
            case AGGREGATING -> COMPLETED;
            case COMPLETED, FAILED -> this;
        };
    }

    public boolean canTransitionTo(AnalysisStage target) {
        if (target == null || isTerminal()) return false;
        if (target == FAILED) return true;
        return target == next();
    }
}
