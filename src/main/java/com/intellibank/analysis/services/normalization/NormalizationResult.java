package com.intellibank.analysis.services.normalization;

import java.util.List;

import com.intellibank.analysis.entities.Transaction;

/**
 * @param transactions   canonical transactions sorted by posted date, then document order
 * @param unparsableCount records excluded because they could not be normalized
 * @param issues         one message per excluded record
 */
public record NormalizationResult(List<Transaction> transactions, int unparsableCount, List<String> issues) {

    public NormalizationResult {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }

    public boolean hasUnparsableRecords() {
        return unparsableCount > 0;
    }

    public String issueSummary() {
        if (issues.isEmpty()) return null;
        return unparsableCount + " record(s) skipped: " + String.join("; ", issues);
    }
}
