package com.paideia.backend.modules.access.domain;

import com.paideia.backend.modules.categoryrole.domain.CategoryRole;
import com.paideia.backend.modules.course.domain.EnrollmentRole;

/**
 * Outcome of a course access check. A denial is a regular result with {@link AccessSource#NONE}.
 *
 * @param role enrollment or category role value, {@code null} when access is denied
 */
public record CourseAccessResult(boolean hasAccess, AccessSource source, String role) {

    private static final CourseAccessResult DENIED = new CourseAccessResult(false, AccessSource.NONE, null);

    public static CourseAccessResult globalAdmin() {
        return new CourseAccessResult(true, AccessSource.GLOBAL_ADMIN, EnrollmentRole.MANAGER.getValue());
    }

    public static CourseAccessResult enrollment(EnrollmentRole role) {
        return new CourseAccessResult(true, AccessSource.ENROLLMENT, role.getValue());
    }

    public static CourseAccessResult category(CategoryRole role) {
        return new CourseAccessResult(true, AccessSource.CATEGORY, role.getValue());
    }

    public static CourseAccessResult denied() {
        return DENIED;
    }

    public boolean satisfies(String requiredRole) {
        return hasAccess && AccessRoleHierarchy.hasMinimumRole(role, requiredRole);
    }
}
