package com.intellibank.analysis.entities;

import com.intellibank.analysis.enums.AnalysisStage;
import com.intellibank.analysis.enums.ErrorKind;

/**
 * Error information attached to a job. A completed job may still carry one, reporting the
 * records skipped during normalization.
 */
public record JobErrorDetail(
        AnalysisStage failedStage,
        ErrorKind kind,
        String message,
        int unparsableRecordCount,
        int attempts
) {
    private static final int MAX_MESSAGE_LENGTH = 2000;

    public JobErrorDetail {
        message = trim(message);
        if (unparsableRecordCount < 0) unparsableRecordCount = 0;
    }

    public static JobErrorDetail unparsableRecords(int count, String message) {
        return new JobErrorDetail(null, ErrorKind.UNPARSABLE_RECORD, message, count, 0);
    }

    public static JobErrorDetail failure(AnalysisStage stage, ErrorKind kind, String message, int attempts) {
        return new JobErrorDetail(stage, kind, message, 0, attempts);
    }

    public JobErrorDetail withUnparsableRecordCount(int count) {
        return new JobErrorDetail(failedStage, kind, message, count, attempts);
    }

    public boolean isFailure() {
        return failedStage != null;
    }

    private static String trim(String message) {
        if (message == null) return null;
        String m = message.trim();
        if (m.length() <= MAX_MESSAGE_LENGTH) return m;
        return m.substring(0, MAX_MESSAGE_LENGTH - 3) + "...";
    }
}
