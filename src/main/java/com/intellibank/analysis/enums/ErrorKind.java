package com.intellibank.analysis.enums;

public enum ErrorKind {
    UNSUPPORTED_FORMAT,
    CORRUPT_INPUT,
    SCHEMA_NOT_FOUND,
    UNPARSABLE_RECORD,
    CLASSIFIER_UNAVAILABLE,
    STAGE_TIMEOUT,
    STORAGE_UNAVAILABLE,
    DUPLICATE_JOB,
    NOT_READY,
    JOB_NOT_FOUND,
    CANCELLED,
    INTERNAL
}
