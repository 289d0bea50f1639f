package com.intellibank.analysis.enums;

public enum AnomalyReason {
    /** Absolute amount above mean + k * stddev of the category baseline. */
    CATEGORY_OUTLIER,
    /** First transaction ever seen for a merchant, above the absolute threshold. */
    UNSEEN_MERCHANT,
    /** Same date, amount and merchant as an earlier transaction of the same statement. */
    DUPLICATE
}
