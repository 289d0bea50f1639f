package com.intellibank.analysis.services.normalization;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class MerchantNameNormalizerTest {

    @Test
    void stripsProcessorPrefixesDatesAndCardNumbers() {
        assertEquals("BLUE BOTTLE COFFEE",
                MerchantNameNormalizer.normalize("POS PURCHASE SQ *BLUE BOTTLE COFFEE 01/14 CARD 4821"));
        assertEquals("CHIPOTLE",
                MerchantNameNormalizer.normalize("DEBIT CARD PURCHASE - CHIPOTLE XXXX4821"));
        assertEquals("SPOTIFY USA",
                MerchantNameNormalizer.normalize("PAYPAL *SPOTIFY USA"));
    }

    @Test
    void dropsStoreNumbersAndReferences() {
        assertEquals("STARBUCKS STORE", MerchantNameNormalizer.normalize("STARBUCKS STORE #1234"));
        assertEquals("SHELL OIL", MerchantNameNormalizer.normalize("Shell Oil 57442298 REF 99812"));
    }

    @Test
    void keepsApostrophesAndAmpersandsInsideNames() {
        assertEquals("MCDONALD'S", MerchantNameNormalizer.normalize("McDonald's 0423"));
        assertEquals("H&M", MerchantNameNormalizer.normalize("H&M"));
    }

    @Test
    void fallsBackToTheRawTextWhenEverythingIsNoise() {
        assertEquals("12345678", MerchantNameNormalizer.normalize("12345678"));
        assertEquals("", MerchantNameNormalizer.normalize("   "));
        assertEquals("", MerchantNameNormalizer.normalize(null));
    }
}
