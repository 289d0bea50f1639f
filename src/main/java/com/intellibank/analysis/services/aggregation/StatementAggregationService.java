package com.intellibank.analysis.services.aggregation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

import org.springframework.stereotype.Service;

import com.intellibank.analysis.classification.Category;
import com.intellibank.analysis.dto.CategoryTotalDTO;
import com.intellibank.analysis.dto.RecurringMerchantDTO;
import com.intellibank.analysis.dto.RecurringMerchantDTO.RecurrenceFrequency;
import com.intellibank.analysis.dto.StatementSummaryDTO;
import com.intellibank.analysis.entities.Transaction;
import com.intellibank.analysis.util.NormalizeUtil;

import lombok.extern.slf4j.Slf4j;

/**
 * Folds categorized transactions into a period summary. The result depends only on the multiset
 * of transactions, never on their order, and the transactions are not modified.
 */
@Service
@Slf4j
public class StatementAggregationService {

    static final int TOP_CATEGORIES = 3;

    /** Charges of a recurring merchant stay within this share of their median. */
    static final BigDecimal RECURRING_AMOUNT_TOLERANCE = new BigDecimal("0.10");

    private static final Comparator<Transaction> CHRONOLOGICAL = Comparator
            .comparing(Transaction::getPostedDate, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingInt(Transaction::getSourceIndex);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public StatementSummaryDTO aggregate(List<Transaction> transactions) {
        return aggregate(transactions, null);
    }

    public StatementSummaryDTO aggregate(List<Transaction> transactions, StatementSummaryDTO previous) {
        List<Transaction> txs = transactions == null ? List.of() : transactions;

        Map<String, Accumulator> byCategory = new TreeMap<>();
        long income = 0L;
        long expenses = 0L;
        LocalDate start = null;
        LocalDate end = null;

        for (Transaction t : txs) {
            String label = (t.getCategory() == null ? Category.UNCATEGORIZED : t.getCategory()).label();
            byCategory.computeIfAbsent(label, k -> new Accumulator()).add(t.getAmount());

            if (t.getAmount() > 0) income = Math.addExact(income, t.getAmount());
            else expenses = Math.addExact(expenses, -t.getAmount());

            LocalDate d = t.getPostedDate();
            if (d != null) {
                if (start == null || d.isBefore(start)) start = d;
                if (end == null || d.isAfter(end)) end = d;
            }
        }

        Map<String, Long> previousTotals = previousTotals(previous);

        List<CategoryTotalDTO> totals = new ArrayList<>();
        for (Map.Entry<String, Accumulator> e : byCategory.entrySet()) {
            Accumulator acc = e.getValue();
            Long delta = previous == null ? null : acc.total - previousTotals.getOrDefault(e.getKey(), 0L);
            totals.add(CategoryTotalDTO.builder()
                    .category(e.getKey())
                    .total(acc.total)
                    .spend(acc.spend)
                    .count(acc.count)
                    .percent(percent(acc.spend, expenses))
                    .deltaFromPrevious(delta)
                    .build());
        }
        totals.sort(Comparator.comparingLong(CategoryTotalDTO::getSpend).reversed()
                .thenComparing(CategoryTotalDTO::getCategory));

        List<String> top = totals.stream()
                .filter(c -> c.getSpend() > 0)
                .limit(TOP_CATEGORIES)
                .map(CategoryTotalDTO::getCategory)
                .toList();

        long net = income - expenses;
        Optional<Transaction> firstWithBalance = txs.stream().filter(t -> t.getBalance() != null).min(CHRONOLOGICAL);
        Optional<Transaction> lastWithBalance = txs.stream().filter(t -> t.getBalance() != null).max(CHRONOLOGICAL);

        return StatementSummaryDTO.builder()
                .currency(dominantCurrency(txs))
                .periodStart(start)
                .periodEnd(end)
                .transactionCount(txs.size())
                .totalIncome(income)
                .totalExpenses(expenses)
                .netCashFlow(net)
                .savingsRate(percent(net, income))
                .expenseRatio(percent(expenses, income))
                .openingBalance(firstWithBalance.map(t -> Math.subtractExact(t.getBalance(), t.getAmount())).orElse(null))
                .closingBalance(lastWithBalance.map(Transaction::getBalance).orElse(null))
                .categoryTotals(totals)
                .topCategories(top)
                .recurringMerchants(recurringMerchants(txs))
                .build();
    }

    /**
     * Merchants debited on at least two different days for amounts within
     * {@link #RECURRING_AMOUNT_TOLERANCE} of their median, most frequent first.
     */
    static List<RecurringMerchantDTO> recurringMerchants(List<Transaction> txs) {
        Map<String, List<Transaction>> debitsByMerchant = new TreeMap<>();
        for (Transaction t : txs) {
            if (!t.isDebit() || t.getPostedDate() == null) continue;
            String key = NormalizeUtil.looseNormalize(t.getMerchant());
            if (key.isEmpty()) continue;
            debitsByMerchant.computeIfAbsent(key, k -> new ArrayList<>()).add(t);
        }

        List<RecurringMerchantDTO> recurring = new ArrayList<>();
        for (List<Transaction> charges : debitsByMerchant.values()) {
            TreeSet<LocalDate> days = new TreeSet<>();
            charges.forEach(t -> days.add(t.getPostedDate()));
            if (days.size() < 2) continue;

            long[] amounts = charges.stream().mapToLong(Transaction::absoluteAmount).sorted().toArray();
            long median = amounts[amounts.length / 2];
            long tolerance = BigDecimal.valueOf(median).multiply(RECURRING_AMOUNT_TOLERANCE)
                    .setScale(0, RoundingMode.HALF_UP).longValueExact();
            if (amounts[0] < median - tolerance || amounts[amounts.length - 1] > median + tolerance) continue;

            long span = ChronoUnit.DAYS.between(days.first(), days.last());
            long interval = Math.round((double) span / (days.size() - 1));
            String merchant = charges.stream().map(Transaction::getMerchant).min(Comparator.naturalOrder()).orElse("");
            recurring.add(RecurringMerchantDTO.builder()
                    .merchant(merchant)
                    .occurrences(charges.size())
                    .typicalAmount(median)
                    .averageIntervalDays(interval)
                    .frequency(RecurrenceFrequency.ofInterval(interval))
                    .build());
        }
        recurring.sort(Comparator.comparingInt(RecurringMerchantDTO::getOccurrences).reversed()
                .thenComparing(RecurringMerchantDTO::getMerchant));
        return recurring;
    }

    private static Map<String, Long> previousTotals(StatementSummaryDTO previous) {
        Map<String, Long> map = new HashMap<>();
        if (previous == null || previous.getCategoryTotals() == null) return map;
        for (CategoryTotalDTO c : previous.getCategoryTotals()) {
            map.put(c.getCategory(), c.getTotal());
        }
        return map;
    }

    /**
     * part / whole as a percentage with 2 decimals; zero when whole is zero.
     */
    static BigDecimal percent(long part, long whole) {
        if (whole == 0) return BigDecimal.ZERO.setScale(2);
        return BigDecimal.valueOf(part)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(whole), 2, RoundingMode.HALF_UP);
    }

    /**
     * Most frequent currency, alphabetical on ties.
     */
    private static String dominantCurrency(List<Transaction> txs) {
        Map<String, Integer> counts = new TreeMap<>();
        for (Transaction t : txs) {
            if (t.getCurrency() != null) counts.merge(t.getCurrency(), 1, Integer::sum);
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        if (counts.size() > 1) {
            log.warn("[Aggregator] mixed currencies {} summarized as {}", counts.keySet(), best);
        }
        return best;
    }

    private static final class Accumulator {
        private long total;
        private long spend;
        private int count;

        void add(long amount) {
            total = Math.addExact(total, amount);
            if (amount < 0) spend = Math.addExact(spend, -amount);
            count++;
        }
    }
}
