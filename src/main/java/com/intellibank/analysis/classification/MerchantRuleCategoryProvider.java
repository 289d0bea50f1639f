package com.intellibank.analysis.classification;

import java.util.Optional;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.intellibank.analysis.classification.rules.MerchantMappings;
import com.intellibank.analysis.config.AnalysisProperties;
import com.intellibank.analysis.entities.Transaction;
import com.intellibank.analysis.util.NormalizeUtil;

import lombok.extern.slf4j.Slf4j;

/**
 * Curated merchant mappings first, then catalog hints. Only suggestions at or above the rule
 * threshold are final.
 */
@Component
@Order(10)
@Slf4j
public class MerchantRuleCategoryProvider implements CategoryProvider {

    static final String NAME = "merchant-rules";

    private static final double HINT_CONFIDENCE = 0.9;

    private final CategoryCatalog catalog;
    private final double threshold;

    public MerchantRuleCategoryProvider(CategoryCatalog catalog, AnalysisProperties properties) {
        this.catalog = catalog;
        this.threshold = properties.categorization().ruleConfidenceThreshold();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<CategoryAssignment> suggest(Transaction transaction) {
        String loose = NormalizeUtil.looseNormalize(transaction.getMerchant());
        if (loose.isEmpty()) return Optional.empty();

        Optional<CategoryAssignment> mapped = MerchantMappings.bestMatch(loose)
                .map(m -> new CategoryAssignment(m.category(), m.confidence(), NAME));
        if (mapped.isPresent() && accepts(mapped.get())) {
            return mapped;
        }

        Optional<CategoryAssignment> hinted = catalog.matchHint(loose)
                .map(c -> new CategoryAssignment(c, HINT_CONFIDENCE, NAME));
        if (hinted.isPresent()) {
            log.debug("[Categorization] merchant='{}' hint -> {}", transaction.getMerchant(), hinted.get().category());
            return hinted;
        }
        return mapped;
    }

    @Override
    public boolean accepts(CategoryAssignment suggestion) {
        return suggestion.confidence() >= threshold;
    }
}
