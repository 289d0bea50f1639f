package com.intellibank.analysis.repositories;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Repository;

import com.intellibank.analysis.dto.StatementSummaryDTO;
import com.intellibank.analysis.entities.Transaction;

@Repository
public class InMemoryTransactionHistoryRepository implements TransactionHistoryRepository {

    private final Map<String, AccountHistory> byAccount = new ConcurrentHashMap<>();

    @Override
    public List<Transaction> findByAccountId(String accountId) {
        if (accountId == null) return List.of();
        AccountHistory history = byAccount.get(accountId);
        return history == null ? List.of() : copies(history.transactions());
    }

    @Override
    public Optional<StatementSummaryDTO> findLatestSummary(String accountId) {
        if (accountId == null) return Optional.empty();
        AccountHistory history = byAccount.get(accountId);
        return history == null ? Optional.empty() : Optional.ofNullable(history.latestSummary());
    }

    @Override
    public void append(String accountId, List<Transaction> transactions, StatementSummaryDTO summary) {
        if (accountId == null) return;
        byAccount.merge(accountId,
                new AccountHistory(copies(transactions), summary),
                (existing, added) -> {
                    List<Transaction> merged = new ArrayList<>(existing.transactions());
                    merged.addAll(added.transactions());
                    return new AccountHistory(List.copyOf(merged), added.latestSummary());
                });
    }

    private static List<Transaction> copies(List<Transaction> transactions) {
        if (transactions == null) return List.of();
        return transactions.stream().map(Transaction::copy).toList();
    }

    private record AccountHistory(List<Transaction> transactions, StatementSummaryDTO latestSummary) {
    }
}
