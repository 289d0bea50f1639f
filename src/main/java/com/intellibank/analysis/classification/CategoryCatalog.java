package com.intellibank.analysis.classification;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.intellibank.analysis.util.NormalizeUtil;

/**
 * Immutable set of known categories with their merchant hints. Built once at startup and shared
 * by all jobs.
 */
public final class CategoryCatalog {

    private static final Map<Category, List<String>> BUILT_IN_HINTS;

    static {
        Map<Category, List<String>> hints = new LinkedHashMap<>();
        hints.put(Category.FOOD, List.of("starbucks", "mcdonald s", "chipotle", "doordash", "grubhub",
                "uber eats", "dunkin", "subway", "panera", "domino s"));
        hints.put(Category.GROCERIES, List.of("whole foods", "trader joe s", "kroger", "safeway", "aldi",
                "costco", "publix", "wegmans"));
        hints.put(Category.TRANSPORTATION, List.of("lyft", "chevron", "exxonmobil", "exxon", "shell oil", "mta",
                "bart", "parkwhiz"));
        hints.put(Category.ENTERTAINMENT, List.of("netflix", "spotify", "hulu", "disney plus", "amc theatres",
                "steam games", "ticketmaster"));
        hints.put(Category.SHOPPING, List.of("best buy", "ebay", "etsy", "ikea", "home depot"));
        hints.put(Category.UTILITIES, List.of("comcast", "xfinity", "verizon wireless", "t mobile", "con edison",
                "pg e", "duke energy"));
        hints.put(Category.HOUSING, List.of("rent payment", "mortgage", "hoa dues"));
        hints.put(Category.HEALTH, List.of("cvs pharmacy", "walgreens", "rite aid", "kaiser"));
        hints.put(Category.TRAVEL, List.of("airbnb", "expedia", "delta air", "united airlines", "american airlines",
                "marriott", "hilton", "booking com"));
        hints.put(Category.INCOME, List.of("payroll", "direct deposit", "salary"));
        hints.put(Category.TRANSFERS, List.of("zelle", "venmo", "cash app", "wire transfer"));
        hints.put(Category.FEES, List.of("overdraft fee", "monthly service fee", "atm fee", "foreign transaction fee"));
        hints.put(Category.UNCATEGORIZED, List.of());
        BUILT_IN_HINTS = Collections.unmodifiableMap(hints);
    }

    private final Map<String, Category> byLabel;
    private final Map<Category, List<String>> hints;

    private CategoryCatalog(Map<Category, List<String>> hints) {
        Map<String, Category> labels = new LinkedHashMap<>();
        Map<Category, List<String>> normalized = new LinkedHashMap<>();
        for (Map.Entry<Category, List<String>> e : hints.entrySet()) {
            labels.put(key(e.getKey().label()), e.getKey());
            List<String> list = new ArrayList<>();
            for (String h : e.getValue()) {
                String n = NormalizeUtil.looseNormalize(h);
                if (!n.isEmpty()) list.add(n);
            }
            normalized.put(e.getKey(), List.copyOf(list));
        }
        this.byLabel = Collections.unmodifiableMap(labels);
        this.hints = Collections.unmodifiableMap(normalized);
    }

    public static CategoryCatalog builtIn() {
        return withExtras(Map.of());
    }

    /**
     * Built-in categories plus configured ones. A configured label that matches a built-in one
     * (ignoring case) adds hints to it.
     */
    public static CategoryCatalog withExtras(Map<String, List<String>> extraCategories) {
        Map<Category, List<String>> merged = new LinkedHashMap<>();
        BUILT_IN_HINTS.forEach((c, h) -> merged.put(c, new ArrayList<>(h)));

        if (extraCategories != null) {
            extraCategories.forEach((label, extraHints) -> {
                Category category = merged.keySet().stream()
                        .filter(c -> c.label().equalsIgnoreCase(label.trim()))
                        .findFirst()
                        .orElseGet(() -> new Category(label));
                merged.computeIfAbsent(category, c -> new ArrayList<>())
                        .addAll(extraHints == null ? List.of() : extraHints);
            });
        }
        return new CategoryCatalog(merged);
    }

    public Optional<Category> find(String label) {
        if (label == null || label.isBlank()) return Optional.empty();
        return Optional.ofNullable(byLabel.get(key(label)));
    }

    public List<Category> categories() {
        return List.copyOf(byLabel.values());
    }

    public List<String> hintsFor(Category category) {
        return hints.getOrDefault(category, List.of());
    }

    /**
     * Category whose hint occurs as whole words in the merchant text; the longest hint wins.
     */
    public Optional<Category> matchHint(String merchantText) {
        String text = " " + NormalizeUtil.looseNormalize(merchantText) + " ";
        if (text.isBlank()) return Optional.empty();

        Category best = null;
        int bestLength = 0;
        for (Map.Entry<Category, List<String>> e : hints.entrySet()) {
            for (String hint : e.getValue()) {
                if (hint.length() > bestLength && text.contains(" " + hint + " ")) {
                    best = e.getKey();
                    bestLength = hint.length();
                }
            }
        }
        return Optional.ofNullable(best);
    }

    private static String key(String label) {
        return label.trim().toLowerCase(Locale.ROOT);
    }
}
