package com.intellibank.analysis.exceptions;

import java.time.Duration;

import com.intellibank.analysis.enums.AnalysisStage;
import com.intellibank.analysis.enums.ErrorKind;

public class StageTimeoutException extends StatementAnalysisException {

    public StageTimeoutException(AnalysisStage stage, Duration budget) {
        super(ErrorKind.STAGE_TIMEOUT, true,
                "Stage " + stage + " exceeded its budget of " + budget.toMillis() + "ms");
    }
}
