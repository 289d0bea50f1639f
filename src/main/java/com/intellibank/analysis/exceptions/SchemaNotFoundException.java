package com.intellibank.analysis.exceptions;

import com.intellibank.analysis.enums.ErrorKind;

/**
 * No header row covering date, description and amount was found inside the scan window.
 */
public class SchemaNotFoundException extends StatementAnalysisException {

    public SchemaNotFoundException(String message) {
        super(ErrorKind.SCHEMA_NOT_FOUND, false, message);
    }

    public SchemaNotFoundException(String message, Throwable cause) {
        super(ErrorKind.SCHEMA_NOT_FOUND, false, message, cause);
    }
}
