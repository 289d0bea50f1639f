package com.intellibank.analysis.exceptions;

import java.util.UUID;

import com.intellibank.analysis.enums.ErrorKind;

public class DuplicateJobException extends StatementAnalysisException {

    private final UUID activeJobId;

    public DuplicateJobException(String uploadId, UUID activeJobId) {
        super(ErrorKind.DUPLICATE_JOB, false,
                "An analysis job is already active for upload " + uploadId + " (jobId=" + activeJobId + ")");
        this.activeJobId = activeJobId;
    }

    public UUID getActiveJobId() {
        return activeJobId;
    }
}
