package com.intellibank.analysis.services.extraction;

import java.util.List;

/**
 * Canonical statement columns with the header labels that identify them. Labels are compared
 * after {@link HeaderLocator#normalizeLabel(String)}.
 */
public enum RawColumn {
    DEBIT(List.of("debit", "debits", "debit amount", "withdrawal", "withdrawals", "money out", "paid out", "outflow")),
    CREDIT(List.of("credit", "credits", "credit amount", "deposit", "deposits", "money in", "paid in", "inflow")),
    BALANCE(List.of("balance", "running balance", "ledger balance", "available balance")),
    TYPE(List.of("type", "transaction type", "dr cr", "debit credit", "cr dr")),
    CURRENCY(List.of("currency", "ccy", "currency code")),
    DATE(List.of("date", "posted date", "posting date", "post date", "transaction date", "trans date",
            "value date", "booking date")),
    DESCRIPTION(List.of("description", "details", "transaction details", "transaction description", "memo",
            "narrative", "payee", "merchant", "particulars", "name")),
    AMOUNT(List.of("amount", "amt", "value", "transaction amount"));

    private final List<String> labels;

    RawColumn(List<String> labels) {
        this.labels = labels;
    }

    public List<String> labels() {
        return labels;
    }

    public boolean isMoney() {
        return this == AMOUNT || this == DEBIT || this == CREDIT || this == BALANCE;
    }
}
