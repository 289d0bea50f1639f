package com.intellibank.analysis.entities;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import com.intellibank.analysis.dto.CategoryTotalDTO;
import com.intellibank.analysis.dto.StatementSummaryDTO;

/**
 * Final output of a completed job, immutable once built. Transactions are copied in and handed out
 * as fresh copies, and the summary is a value object.
 */
public record AnalysisResult(
        UUID jobId,
        String uploadId,
        List<Transaction> transactions,
        StatementSummaryDTO summary,
        List<UUID> anomalousTransactionIds,
        Instant createdAt,
        Duration processingTime
) {
    public AnalysisResult {
        if (jobId == null) throw new IllegalArgumentException("jobId is required");
        transactions = transactions == null ? List.of() : transactions.stream().map(Transaction::copy).toList();
        anomalousTransactionIds = anomalousTransactionIds == null ? List.of() : List.copyOf(anomalousTransactionIds);
    }

    @Override
    public List<Transaction> transactions() {
        return transactions.stream().map(Transaction::copy).toList();
    }

    public List<CategoryTotalDTO> categoryTotals() {
        return summary == null ? List.of() : summary.getCategoryTotals();
    }
}
