package com.intellibank.analysis.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Period summary of a statement. Money fields are minor units of {@link #currency}.
 */
@Value
public class StatementSummaryDTO {
    String currency;
    LocalDate periodStart;
    LocalDate periodEnd;
    int transactionCount;
    long totalIncome;
    long totalExpenses;
    long netCashFlow;
    BigDecimal savingsRate;
    BigDecimal expenseRatio;
    /** Balance before the first transaction; null when the statement prints no balances. */
    Long openingBalance;
    /** Balance after the last transaction; null when the statement prints no balances. */
    Long closingBalance;
    List<CategoryTotalDTO> categoryTotals;
    List<String> topCategories;
    List<RecurringMerchantDTO> recurringMerchants;

    @Builder
    private StatementSummaryDTO(String currency, LocalDate periodStart, LocalDate periodEnd, int transactionCount,
                                long totalIncome, long totalExpenses, long netCashFlow,
                                BigDecimal savingsRate, BigDecimal expenseRatio,
                                Long openingBalance, Long closingBalance,
                                List<CategoryTotalDTO> categoryTotals, List<String> topCategories,
                                List<RecurringMerchantDTO> recurringMerchants) {
        this.currency = currency;
        this.periodStart = periodStart;
        this.periodEnd = periodEnd;
        this.transactionCount = transactionCount;
        this.totalIncome = totalIncome;
        this.totalExpenses = totalExpenses;
        this.netCashFlow = netCashFlow;
        this.savingsRate = savingsRate;
        this.expenseRatio = expenseRatio;
        this.openingBalance = openingBalance;
        this.closingBalance = closingBalance;
        this.categoryTotals = categoryTotals == null ? List.of() : List.copyOf(categoryTotals);
        this.topCategories = topCategories == null ? List.of() : List.copyOf(topCategories);
        this.recurringMerchants = recurringMerchants == null ? List.of() : List.copyOf(recurringMerchants);
    }
}
