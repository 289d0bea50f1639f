package com.intellibank.analysis.util;

import java.text.Normalizer;
import java.util.Locale;

public final class NormalizeUtil {

    private NormalizeUtil() {}

    /**
     * Lowercases, strips accents and collapses whitespace.
     * Example: "  Café  Nero " => "cafe nero"
     */
    public static String normalize(String text) {
        if (text == null || text.isBlank()) return "";

        String result = text.toLowerCase(Locale.ROOT);

        result = Normalizer.normalize(result, Normalizer.Form.NFD);
        result = result.replaceAll("\\p{M}", "");

        // PDFBox emits NBSP and other separators that \s does not match
        result = result.replace('\u00A0', ' ');
        result = result.replaceAll("\\p{Z}+", " ");

        return result.replaceAll("\\s+", " ").trim();
    }

    /**
     * Like {@link #normalize(String)} but also drops everything that is not a letter, digit or
     * space. Used as lookup key for merchants.
     */
    public static String looseNormalize(String text) {
        String n = normalize(text);
        if (n.isEmpty()) return n;
        return n.replaceAll("[^a-z0-9 ]+", " ").replaceAll("\\s+", " ").trim();
    }

    /**
     * Whole-word containment on loosely normalized text, so "uber" does not match "tuber".
     */
    public static boolean containsWord(String text, String keyword) {
        String k = looseNormalize(keyword);
        if (k.isEmpty()) return false;
        return (" " + looseNormalize(text) + " ").contains(" " + k + " ");
    }
}
