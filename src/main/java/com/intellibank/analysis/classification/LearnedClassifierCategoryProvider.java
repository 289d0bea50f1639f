package com.intellibank.analysis.classification;

import java.util.Optional;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.intellibank.analysis.entities.Transaction;

import lombok.extern.slf4j.Slf4j;

/**
 * Asks the configured {@link ClassifierBackend}. Labels the catalog does not know are ignored.
 */
@Component
@Order(20)
@Slf4j
public class LearnedClassifierCategoryProvider implements CategoryProvider {

    static final String NAME = "classifier";

    private final ClassifierBackend backend;
    private final CategoryCatalog catalog;

    public LearnedClassifierCategoryProvider(ClassifierBackend backend, CategoryCatalog catalog) {
        this.backend = backend;
        this.catalog = catalog;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Optional<CategoryAssignment> suggest(Transaction transaction) {
        ClassifierVerdict verdict = backend.classify(transaction.getMerchant(), transaction.getRawDescription());
        if (verdict == null || verdict.isEmpty()) return Optional.empty();

        Optional<Category> category = catalog.find(verdict.label());
        if (category.isEmpty()) {
            log.debug("[Categorization] classifier returned unknown label='{}' merchant='{}'",
                    verdict.label(), transaction.getMerchant());
            return Optional.empty();
        }
        return Optional.of(new CategoryAssignment(category.get(), verdict.confidence(), NAME));
    }

    @Override
    public boolean accepts(CategoryAssignment suggestion) {
        return suggestion.confidence() > 0.0;
    }
}
