package com.intellibank.analysis.repositories;

import java.util.List;
import java.util.Optional;

import com.intellibank.analysis.dto.StatementSummaryDTO;
import com.intellibank.analysis.entities.Transaction;

/**
 * Categorized transactions and summaries of an account's previously completed statements.
 */
public interface TransactionHistoryRepository {

    List<Transaction> findByAccountId(String accountId);

    Optional<StatementSummaryDTO> findLatestSummary(String accountId);

    void append(String accountId, List<Transaction> transactions, StatementSummaryDTO summary);
}
