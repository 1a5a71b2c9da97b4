package com.paideia.backend.modules.access.domain;

import java.util.Map;

/**
 * Single ranking across course enrollment roles and category roles, so a page can demand
 * "at least teacher" and accept a category coordinator as well.
 */
public final class AccessRoleHierarchy {

    private static final Map<String, Integer> PRIORITIES = Map.of(
            "category-admin", 6,
            "manager", 6,
            "category-coordinator", 5,
            "teacher", 5,
            "category-reviewer", 4,
            "ta", 3,
            "student", 1
    );

    private AccessRoleHierarchy() {
    }

    public static int priorityOf(String role) {
        return role == null ? 0 : PRIORITIES.getOrDefault(role, 0);
    }

    public static boolean hasMinimumRole(String userRole, String requiredRole) {
        return priorityOf(userRole) >= priorityOf(requiredRole);
    }
}
