package com.intellibank.analysis.exceptions;

import com.intellibank.analysis.enums.ErrorKind;

/**
 * The file bytes cannot be read as the declared format.
 */
public class CorruptInputException extends StatementAnalysisException {

    public CorruptInputException(String message) {
        super(ErrorKind.CORRUPT_INPUT, false, message);
    }

    public CorruptInputException(String message, Throwable cause) {
        super(ErrorKind.CORRUPT_INPUT, false, message, cause);
    }
}
