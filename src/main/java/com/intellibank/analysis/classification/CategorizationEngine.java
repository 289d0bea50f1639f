package com.intellibank.analysis.classification;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Service;

import com.intellibank.analysis.config.AnalysisProperties;
import com.intellibank.analysis.entities.Transaction;
import com.intellibank.analysis.util.NormalizeUtil;

import lombok.extern.slf4j.Slf4j;

/**
 * Assigns exactly one category to a transaction by asking the providers in order. Total: when no
 * provider is confident the answer is {@link Category#UNCATEGORIZED} with confidence 0.
 *
 * <p>Answers are cached by normalized merchant. A provider failure (classifier unavailable)
 * propagates and leaves the cache untouched.
 */
@Service
@Slf4j
public class CategorizationEngine {

    private final List<CategoryProvider> providers;
    private final boolean cacheEnabled;
    private final int cacheMaxEntries;
    private final Map<String, CategoryAssignment> cache = new ConcurrentHashMap<>();

    public CategorizationEngine(List<CategoryProvider> providers, AnalysisProperties properties) {
        if (providers == null || providers.isEmpty()) {
            throw new IllegalArgumentException("At least one category provider is required");
        }
        this.providers = List.copyOf(providers);
        this.cacheEnabled = properties.categorization().cacheEnabled();
        this.cacheMaxEntries = properties.categorization().cacheMaxEntries();
    }

    public CategoryAssignment categorize(Transaction transaction) {
        if (transaction == null) {
            throw new IllegalArgumentException("transaction is required");
        }

        String key = NormalizeUtil.looseNormalize(transaction.getMerchant());
        if (cacheEnabled && !key.isEmpty()) {
            CategoryAssignment cached = cache.get(key);
            if (cached != null) return cached;
        }

        CategoryAssignment assignment = decide(transaction);

        if (cacheEnabled && !key.isEmpty()) {
            if (cache.size() >= cacheMaxEntries) {
                cache.clear();
            }
            cache.putIfAbsent(key, assignment);
        }
        return assignment;
    }

    private CategoryAssignment decide(Transaction transaction) {
        for (CategoryProvider provider : providers) {
            Optional<CategoryAssignment> suggestion = provider.suggest(transaction);
            if (suggestion.isPresent() && provider.accepts(suggestion.get())) {
                log.debug("[Categorization] merchant='{}' category={} confidence={} source={}",
                        transaction.getMerchant(), suggestion.get().category(),
                        suggestion.get().confidence(), provider.name());
                return suggestion.get();
            }
        }
        log.debug("[Categorization] merchant='{}' no confident provider -> {}",
                transaction.getMerchant(), Category.UNCATEGORIZED);
        return CategoryAssignment.uncategorized();
    }

    public int cacheSize() {
        return cache.size();
    }
}
