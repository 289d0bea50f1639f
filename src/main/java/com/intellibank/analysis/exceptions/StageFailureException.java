package com.intellibank.analysis.exceptions;

import com.intellibank.analysis.enums.AnalysisStage;
import com.intellibank.analysis.enums.ErrorKind;

/**
 * A pipeline stage gave up: either a non-retryable error or retries exhausted. Carries what the
 * job's error detail needs.
 */
public class StageFailureException extends StatementAnalysisException {

    private final AnalysisStage stage;
    private final int attempts;

    public StageFailureException(AnalysisStage stage, int attempts, ErrorKind kind, Throwable cause) {
        super(kind, false, describe(stage, attempts, cause), cause);
        this.stage = stage;
        this.attempts = attempts;
    }

    public AnalysisStage getStage() {
        return stage;
    }

    public int getAttempts() {
        return attempts;
    }

    private static String describe(AnalysisStage stage, int attempts, Throwable cause) {
        String reason = cause == null ? "unknown error" : cause.getMessage();
        if (reason == null || reason.isBlank()) reason = cause.getClass().getSimpleName();
        return reason + " (stage=" + stage + ", attempts=" + attempts + ")";
    }
}
