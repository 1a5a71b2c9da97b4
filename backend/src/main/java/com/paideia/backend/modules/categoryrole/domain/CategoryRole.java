package com.paideia.backend.modules.categoryrole.domain;

/**
 * Ranked grants on a category. A grant applies to the category and everything below it.
 */
public enum CategoryRole {
    CATEGORY_ADMIN("category-admin", 3),
    CATEGORY_COORDINATOR("category-coordinator", 2),
    CATEGORY_REVIEWER("category-reviewer", 1);

    private final String value;
    private final int priority;

    CategoryRole(String value, int priority) {
        this.value = value;
        this.priority = priority;
    }

    public String getValue() {
        return value;
    }

    public boolean outranks(CategoryRole other) {
        return other == null || priority > other.priority;
    }
}
