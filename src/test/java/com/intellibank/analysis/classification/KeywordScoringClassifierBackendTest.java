package com.intellibank.analysis.classification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class KeywordScoringClassifierBackendTest {

    private final KeywordScoringClassifierBackend backend = new KeywordScoringClassifierBackend();

    @Test
    void scoresKeywordsFromMerchantAndDescription() {
        ClassifierVerdict pizza = backend.classify("JOE'S PIZZA", "");
        assertEquals("Food", pizza.label());
        assertEquals(0.80, pizza.confidence());

        ClassifierVerdict water = backend.classify("CITY OF SPRINGFIELD", "WATER UTILITY PAYMENT");
        assertEquals("Utilities", water.label());
        assertEquals(0.88, water.confidence());
    }

    @Test
    void matchesWholeWordsOnly() {
        assertTrue(backend.classify("RENTAL CAR CENTER", null).isEmpty());
    }

    @Test
    void earlierCategoryWinsTies() {
        assertEquals("Groceries", backend.classify("CORNER MARKET STORE", null).label());
    }

    @Test
    void returnsNoneWithoutKeywords() {
        assertTrue(backend.classify("ZQX LLC", "").isEmpty());
        assertTrue(backend.classify(null, null).isEmpty());
    }
}
