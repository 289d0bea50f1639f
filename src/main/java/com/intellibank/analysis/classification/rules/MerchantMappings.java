package com.intellibank.analysis.classification.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.intellibank.analysis.classification.Category;
import com.intellibank.analysis.util.NormalizeUtil;

/**
 * Curated merchant patterns seen on US card and checking statements.
 *
 * Matching is done against a loosely normalized merchant name (lowercase, no accents,
 * non-alphanumerics turned into spaces). All fragments of a pattern must be present as words.
 */
public final class MerchantMappings {

    private MerchantMappings() {}

    public record MerchantMapping(String merchantPattern, Category category, double confidence, List<String> fragments) {
        public MerchantMapping {
            if (merchantPattern == null || merchantPattern.isBlank()) throw new IllegalArgumentException("merchantPattern is required");
            if (category == null) throw new IllegalArgumentException("category is required");
            if (confidence < 0.0 || confidence > 1.0) throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
            if (fragments == null || fragments.isEmpty()) throw new IllegalArgumentException("fragments is required");
        }

        public boolean matchesLoose(String looseNormalizedMerchant) {
            if (looseNormalizedMerchant == null || looseNormalizedMerchant.isBlank()) return false;
            String padded = " " + looseNormalizedMerchant + " ";
            for (String f : fragments) {
                if (!padded.contains(" " + f + " ")) {
                    return false;
                }
            }
            return true;
        }

        public int specificityScore() {
            int sum = 0;
            for (String f : fragments) sum += f.length();
            return sum;
        }
    }

    public static final List<MerchantMapping> MAPPINGS;

    static {
        List<MerchantMapping> items = new ArrayList<>();

        // Food
        items.add(mapping("STARBUCKS", Category.FOOD, 0.97));
        items.add(mapping("BLUE BOTTLE COFFEE", Category.FOOD, 0.95));
        items.add(mapping("DOORDASH", Category.FOOD, 0.95));
        items.add(mapping("UBER EATS", Category.FOOD, 0.96));
        items.add(mapping("CHICK FIL A", Category.FOOD, 0.95));

        // Groceries
        items.add(mapping("WHOLE FOODS MARKET", Category.GROCERIES, 0.97));
        items.add(mapping("TRADER JOE", Category.GROCERIES, 0.96));
        items.add(mapping("INSTACART", Category.GROCERIES, 0.92));
        items.add(mapping("COSTCO WHSE", Category.GROCERIES, 0.80));

        // Transportation
        items.add(mapping("UBER TRIP", Category.TRANSPORTATION, 0.96));
        items.add(mapping("LYFT RIDE", Category.TRANSPORTATION, 0.96));
        items.add(mapping("SHELL OIL", Category.TRANSPORTATION, 0.93));
        items.add(mapping("EZPASS", Category.TRANSPORTATION, 0.95));

        // Entertainment
        items.add(mapping("NETFLIX COM", Category.ENTERTAINMENT, 0.98));
        items.add(mapping("SPOTIFY", Category.ENTERTAINMENT, 0.97));
        items.add(mapping("HBO MAX", Category.ENTERTAINMENT, 0.95));

        // Shopping
        items.add(mapping("AMAZON MKTPLACE", Category.SHOPPING, 0.92));
        items.add(mapping("TARGET", Category.SHOPPING, 0.85));
        items.add(mapping("WALMART", Category.SHOPPING, 0.70));

        // Utilities
        items.add(mapping("COMCAST CABLE", Category.UTILITIES, 0.95));
        items.add(mapping("VERIZON WRLS", Category.UTILITIES, 0.95));

        // Travel
        items.add(mapping("DELTA AIR LINES", Category.TRAVEL, 0.97));
        items.add(mapping("AIRBNB", Category.TRAVEL, 0.95));

        // Health
        items.add(mapping("CVS PHARMACY", Category.HEALTH, 0.93));

        // Transfers / fees
        items.add(mapping("ZELLE TO", Category.TRANSFERS, 0.92));
        items.add(mapping("VENMO", Category.TRANSFERS, 0.80));
        items.add(mapping("OVERDRAFT", Category.FEES, 0.95));

        MAPPINGS = Collections.unmodifiableList(items);
    }

    public static Optional<MerchantMapping> bestMatch(String looseNormalizedMerchant) {
        if (looseNormalizedMerchant == null || looseNormalizedMerchant.isBlank()) {
            return Optional.empty();
        }

        return MAPPINGS.stream()
                .filter(m -> m.matchesLoose(looseNormalizedMerchant))
                .max(Comparator
                        .comparingDouble(MerchantMapping::confidence)
                        .thenComparingInt(MerchantMapping::specificityScore));
    }

    private static MerchantMapping mapping(String pattern, Category category, double confidence) {
        String p = Objects.requireNonNullElse(pattern, "").trim();
        String loose = NormalizeUtil.looseNormalize(p);

        List<String> fragments = new ArrayList<>();
        for (String part : loose.split("\\s+")) {
            if (!part.isBlank()) fragments.add(part);
        }
        return new MerchantMapping(p, category, confidence, Collections.unmodifiableList(fragments));
    }
}
