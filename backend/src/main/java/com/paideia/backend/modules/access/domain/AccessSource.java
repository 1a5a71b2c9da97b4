package com.paideia.backend.modules.access.domain;

/**
 * Where a course access decision came from, in the order the sources are consulted.
 */
public enum AccessSource {
    GLOBAL_ADMIN("global-admin"),
    ENROLLMENT("enrollment"),
    CATEGORY("category"),
    NONE("none");

    private final String value;

    AccessSource(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
