package com.intellibank.analysis.exceptions;

import com.intellibank.analysis.enums.ErrorKind;

/**
 * The classifier backend timed out or is unreachable. Retryable.
 */
public class ClassifierUnavailableException extends StatementAnalysisException {

    public ClassifierUnavailableException(String message) {
        super(ErrorKind.CLASSIFIER_UNAVAILABLE, true, message);
    }

    public ClassifierUnavailableException(String message, Throwable cause) {
        super(ErrorKind.CLASSIFIER_UNAVAILABLE, true, message, cause);
    }
}
