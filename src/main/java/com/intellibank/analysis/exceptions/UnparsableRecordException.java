package com.intellibank.analysis.exceptions;

import com.intellibank.analysis.enums.ErrorKind;

public class UnparsableRecordException extends StatementAnalysisException {

    public UnparsableRecordException(String message) {
        super(ErrorKind.UNPARSABLE_RECORD, false, message);
    }

    public UnparsableRecordException(String message, Throwable cause) {
        super(ErrorKind.UNPARSABLE_RECORD, false, message, cause);
    }
}
