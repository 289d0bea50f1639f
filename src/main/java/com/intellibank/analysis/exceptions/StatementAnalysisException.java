package com.intellibank.analysis.exceptions;

import com.intellibank.analysis.enums.ErrorKind;

/**
 * Root of the analysis error taxonomy. Every subtype carries its {@link ErrorKind} and whether a
 * stage may retry it.
 */
public abstract class StatementAnalysisException extends RuntimeException {

    private final ErrorKind kind;
    private final boolean transientFailure;

    protected StatementAnalysisException(ErrorKind kind, boolean transientFailure, String message) {
        super(message);
        this.kind = kind;
        this.transientFailure = transientFailure;
    }

    protected StatementAnalysisException(ErrorKind kind, boolean transientFailure, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.transientFailure = transientFailure;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}
