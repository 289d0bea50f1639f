package com.intellibank.analysis.dto;

import lombok.Builder;
import lombok.Value;

/**
 * A merchant charged repeatedly, on different days and for a stable amount, within one statement.
 */
@Value
@Builder
public class RecurringMerchantDTO {
    String merchant;
    int occurrences;
    /** Median charge, positive minor units. */
    long typicalAmount;
    long averageIntervalDays;
    RecurrenceFrequency frequency;

    public enum RecurrenceFrequency {
        DAILY, WEEKLY, BIWEEKLY, MONTHLY, IRREGULAR;

        public static RecurrenceFrequency ofInterval(long days) {
            if (days <= 1) return DAILY;
            if (days >= 6 && days <= 8) return WEEKLY;
            if (days >= 13 && days <= 16) return BIWEEKLY;
            if (days >= 27 && days <= 32) return MONTHLY;
            return IRREGULAR;
        }
    }
}
