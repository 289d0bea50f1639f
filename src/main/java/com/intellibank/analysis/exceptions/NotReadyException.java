package com.intellibank.analysis.exceptions;

import java.util.UUID;

import com.intellibank.analysis.enums.AnalysisStage;
import com.intellibank.analysis.enums.ErrorKind;

public class NotReadyException extends StatementAnalysisException {

    public NotReadyException(UUID jobId, AnalysisStage stage) {
        super(ErrorKind.NOT_READY, false, "Result for job " + jobId + " is not ready (stage=" + stage + ")");
    }
}
