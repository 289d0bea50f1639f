package com.intellibank.analysis.classification;

import java.util.Optional;

import com.intellibank.analysis.entities.Transaction;

/**
 * One source of category suggestions. Providers are consulted in {@code @Order} sequence and the
 * first accepted suggestion wins.
 */
public interface CategoryProvider {

    String name();

    Optional<CategoryAssignment> suggest(Transaction transaction);

    /**
     * Whether a suggestion from this provider is confident enough to be final.
     */
    boolean accepts(CategoryAssignment suggestion);
}
