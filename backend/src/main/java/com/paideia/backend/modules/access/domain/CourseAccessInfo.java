package com.paideia.backend.modules.access.domain;

/**
 * One entry of a user's visible-course listing.
 *
 * @param categoryId category whose grant opened the course, only set for {@link AccessSource#CATEGORY}
 */
public record CourseAccessInfo(Long courseId, AccessSource source, String role, Long categoryId) {
}
