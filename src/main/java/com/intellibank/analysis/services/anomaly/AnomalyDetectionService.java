package com.intellibank.analysis.services.anomaly;

import java.util.ArrayList;
import java.util.DoubleSummaryStatistics;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.intellibank.analysis.classification.Category;
import com.intellibank.analysis.config.AnalysisProperties;
import com.intellibank.analysis.entities.Transaction;
import com.intellibank.analysis.enums.AnomalyReason;
import com.intellibank.analysis.util.NormalizeUtil;

import lombok.extern.slf4j.Slf4j;

/**
 * Flags transactions that do not fit the account's spending pattern.
 *
 * <ul>
 *   <li>Category outlier: {@code |amount| > mean + k * stddev} of the category baseline.</li>
 *   <li>Unseen merchant: first large payment to a merchant absent from the history. Only with
 *       history.</li>
 *   <li>Duplicate: same date, amount and merchant as an earlier transaction of the statement. The
 *       first occurrence is not flagged.</li>
 * </ul>
 * The baseline is the account history when there is one, otherwise the statement itself.
 * Categories with fewer than {@code minCategorySamples} baseline transactions are never flagged.
 */
@Service
@Slf4j
public class AnomalyDetectionService {

    private final double stddevMultiplier;
    private final int minCategorySamples;
    private final long unseenMerchantThreshold;

    public AnomalyDetectionService(AnalysisProperties properties) {
        AnalysisProperties.Anomaly config = properties.anomaly();
        this.stddevMultiplier = config.stddevMultiplier();
        this.minCategorySamples = config.minCategorySamples();
        this.unseenMerchantThreshold = config.unseenMerchantThresholdMinor();
    }

    /**
     * Sets the anomaly flag and reason on every transaction of {@code transactions}.
     *
     * @return ids of the flagged transactions, in batch order
     */
    public Set<UUID> detectAnomalies(List<Transaction> accountHistory, List<Transaction> transactions) {
        Set<UUID> flagged = new LinkedHashSet<>();
        if (transactions == null || transactions.isEmpty()) return flagged;

        boolean hasHistory = accountHistory != null && !accountHistory.isEmpty();
        List<Transaction> baseline = hasHistory ? accountHistory : transactions;
        Map<Category, CategoryBaseline> baselines = baselinesByCategory(baseline);

        Set<String> seenMerchants = new HashSet<>();
        if (hasHistory) {
            for (Transaction t : accountHistory) seenMerchants.add(merchantKey(t));
        }
        Set<String> seenEntries = new HashSet<>();

        for (Transaction tx : transactions) {
            boolean repeated = !seenEntries.add(entryKey(tx));
            AnomalyReason reason = evaluate(tx, baselines.get(categoryOf(tx)), hasHistory, seenMerchants, repeated);
            seenMerchants.add(merchantKey(tx));

            tx.setAnomaly(reason != null);
            tx.setAnomalyReason(reason);
            if (reason != null) {
                flagged.add(tx.getId());
                log.debug("[AnomalyDetector] flagged merchant='{}' amount={} category={} reason={}",
                        tx.getMerchant(), tx.getAmount(), categoryOf(tx), reason);
            }
        }
        return flagged;
    }

    private AnomalyReason evaluate(Transaction tx, CategoryBaseline stats, boolean hasHistory,
                                   Set<String> seenMerchants, boolean repeated) {
        if (stats == null || stats.count() < minCategorySamples) {
            return null;
        }
        if (repeated) {
            return AnomalyReason.DUPLICATE;
        }
        double magnitude = tx.absoluteAmount();
        if (magnitude > stats.mean() + stddevMultiplier * stats.stddev()) {
            return AnomalyReason.CATEGORY_OUTLIER;
        }
        if (hasHistory && !seenMerchants.contains(merchantKey(tx)) && tx.absoluteAmount() >= unseenMerchantThreshold) {
            return AnomalyReason.UNSEEN_MERCHANT;
        }
        return null;
    }

    private static Map<Category, CategoryBaseline> baselinesByCategory(List<Transaction> baseline) {
        Map<Category, List<Double>> magnitudes = new HashMap<>();
        for (Transaction t : baseline) {
            magnitudes.computeIfAbsent(categoryOf(t), k -> new ArrayList<>()).add((double) t.absoluteAmount());
        }
        Map<Category, CategoryBaseline> result = new HashMap<>();
        magnitudes.forEach((category, values) -> result.put(category, CategoryBaseline.of(values)));
        return result;
    }

    private static Category categoryOf(Transaction t) {
        return t.getCategory() == null ? Category.UNCATEGORIZED : t.getCategory();
    }

    private static String merchantKey(Transaction t) {
        return NormalizeUtil.looseNormalize(t.getMerchant());
    }

    private static String entryKey(Transaction t) {
        return t.getPostedDate() + "|" + t.getAmount() + "|" + merchantKey(t);
    }

    /**
     * Population statistics of absolute amounts.
     */
    record CategoryBaseline(long count, double mean, double stddev) {

        static CategoryBaseline of(List<Double> values) {
            DoubleSummaryStatistics stats = values.stream().mapToDouble(Double::doubleValue).summaryStatistics();
            double mean = stats.getAverage();
            double variance = values.stream()
                    .mapToDouble(v -> Math.pow(v - mean, 2))
                    .average()
                    .orElse(0d);
            return new CategoryBaseline(stats.getCount(), mean, Math.sqrt(variance));
        }
    }
}
