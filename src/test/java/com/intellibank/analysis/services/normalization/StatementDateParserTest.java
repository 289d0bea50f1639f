package com.intellibank.analysis.services.normalization;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.intellibank.analysis.config.AnalysisProperties;

class StatementDateParserTest {

    private final StatementDateParser parser =
            new StatementDateParser(AnalysisProperties.defaults().normalization().dateFormats());

    @Test
    void parsesCommonBankDateFormats() {
        assertEquals(LocalDate.of(2024, 1, 15), parser.parse("2024-01-15").orElseThrow());
        assertEquals(LocalDate.of(2024, 1, 15), parser.parse("01/15/2024").orElseThrow());
        assertEquals(LocalDate.of(2024, 1, 15), parser.parse("15.01.2024").orElseThrow());
        assertEquals(LocalDate.of(2024, 2, 3), parser.parse("3 Feb 2024").orElseThrow());
        assertEquals(LocalDate.of(2024, 2, 3), parser.parse("FEB 3, 2024").orElseThrow());
        assertEquals(LocalDate.of(2024, 2, 3), parser.parse("20240203").orElseThrow());
    }

    @Test
    void firstMatchingPatternWins() {
        // US order is configured before day-first
        assertEquals(LocalDate.of(2024, 1, 2), parser.parse("01/02/2024").orElseThrow());
        // month 15 does not exist, so the day-first pattern applies
        assertEquals(LocalDate.of(2024, 1, 15), parser.parse("15/01/2024").orElseThrow());
    }

    @Test
    void ignoresTimeOfDay() {
        assertEquals(LocalDate.of(2024, 3, 9), parser.parse("2024-03-09T14:22:05").orElseThrow());
        assertEquals(LocalDate.of(2024, 3, 9), parser.parse("2024-03-09 00:00:00").orElseThrow());
    }

    @Test
    void rejectsImpossibleOrMissingDates() {
        assertTrue(parser.parse("2024-02-30").isEmpty());
        assertTrue(parser.parse("yesterday").isEmpty());
        assertTrue(parser.parse("   ").isEmpty());
        assertTrue(parser.parse(null).isEmpty());
    }

    @Test
    void requiresAtLeastOnePattern() {
        assertThrows(IllegalArgumentException.class, () -> new StatementDateParser(List.of()));
    }
}
