package com.intellibank.analysis.exceptions;

import com.intellibank.analysis.enums.ErrorKind;

/**
 * Object storage could not serve the uploaded file right now. Retryable.
 */
public class StorageUnavailableException extends StatementAnalysisException {

    public StorageUnavailableException(String message) {
        super(ErrorKind.STORAGE_UNAVAILABLE, true, message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(ErrorKind.STORAGE_UNAVAILABLE, true, message, cause);
    }
}
