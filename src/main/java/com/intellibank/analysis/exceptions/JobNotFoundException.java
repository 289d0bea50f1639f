package com.intellibank.analysis.exceptions;

import java.util.UUID;

import com.intellibank.analysis.enums.ErrorKind;

public class JobNotFoundException extends StatementAnalysisException {

    public JobNotFoundException(UUID jobId) {
        super(ErrorKind.JOB_NOT_FOUND, false, "Analysis job not found: " + jobId);
    }
}
