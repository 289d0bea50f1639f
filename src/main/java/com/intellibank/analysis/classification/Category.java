package com.intellibank.analysis.classification;

import java.util.List;

/**
 * Spending category. Compared by label; labels are case-sensitive here, lookups by user input go
 * through {@link CategoryCatalog#find(String)}.
 */
public record Category(String label) {

    public static final Category FOOD = new Category("Food");
    public static final Category GROCERIES = new Category("Groceries");
    public static final Category TRANSPORTATION = new Category("Transportation");
    public static final Category ENTERTAINMENT = new Category("Entertainment");
    public static final Category SHOPPING = new Category("Shopping");
    public static final Category UTILITIES = new Category("Utilities");
    public static final Category HOUSING = new Category("Housing");
    public static final Category HEALTH = new Category("Health");
    public static final Category TRAVEL = new Category("Travel");
    public static final Category INCOME = new Category("Income");
    public static final Category TRANSFERS = new Category("Transfers");
    public static final Category FEES = new Category("Fees");
    public static final Category UNCATEGORIZED = new Category("Uncategorized");

    public static final List<Category> BUILT_IN = List.of(
            FOOD, GROCERIES, TRANSPORTATION, ENTERTAINMENT, SHOPPING, UTILITIES, HOUSING,
            HEALTH, TRAVEL, INCOME, TRANSFERS, FEES, UNCATEGORIZED);

    public Category {
        if (label == null || label.isBlank()) throw new IllegalArgumentException("label is required");
        label = label.trim();
    }

    public boolean isUncategorized() {
        return UNCATEGORIZED.equals(this);
    }

    @Override
    public String toString() {
        return label;
    }
}
