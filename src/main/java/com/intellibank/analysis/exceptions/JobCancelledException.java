package com.intellibank.analysis.exceptions;

import java.util.UUID;

import com.intellibank.analysis.enums.ErrorKind;

/**
 * Raised inside a pipeline run once its job is no longer active; aborts the run without
 * touching the job record.
 */
public class JobCancelledException extends StatementAnalysisException {

    public JobCancelledException(UUID jobId) {
        super(ErrorKind.CANCELLED, false, "Analysis job " + jobId + " was cancelled");
    }
}
