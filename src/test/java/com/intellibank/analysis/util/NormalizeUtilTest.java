package com.intellibank.analysis.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NormalizeUtilTest {

    @Test
    void normalizesCaseAccentsAndWhitespace() {
        assertEquals("cafe nero", NormalizeUtil.normalize("  Café  Nero "));
        assertEquals("", NormalizeUtil.normalize(null));
        assertEquals("amazon com", NormalizeUtil.looseNormalize("AMAZON.COM*"));
    }

    @Test
    void containsWordMatchesWholeWordsOnly() {
        assertTrue(NormalizeUtil.containsWord("UBER TRIP HELP.UBER.COM", "uber"));
        assertFalse(NormalizeUtil.containsWord("TUBERS FARM STAND", "uber"));
        assertTrue(NormalizeUtil.containsWord("WHOLE FOODS MARKET", "whole foods"));
        assertFalse(NormalizeUtil.containsWord("anything", "  "));
    }
}
