package com.paideia.backend.modules.access.application;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.paideia.backend.global.error.ProblemException;
import com.paideia.backend.global.error.ProblemKind;
import com.paideia.backend.modules.access.domain.AccessSource;
import com.paideia.backend.modules.access.domain.CourseAccessInfo;
import com.paideia.backend.modules.access.domain.CourseAccessResult;
import com.paideia.backend.modules.category.application.CategoryHierarchyNavigator;
import com.paideia.backend.modules.categoryrole.application.EffectiveCategoryRoleResolver;
import com.paideia.backend.modules.categoryrole.domain.CategoryRole;
import com.paideia.backend.modules.categoryrole.domain.CategoryRoleAssignment;
import com.paideia.backend.modules.categoryrole.infrastructure.persistence.CategoryRoleAssignmentRepository;
import com.paideia.backend.modules.course.domain.Course;
import com.paideia.backend.modules.course.domain.Enrollment;
import com.paideia.backend.modules.course.domain.EnrollmentRole;
import com.paideia.backend.modules.course.infrastructure.persistence.CourseRepository;
import com.paideia.backend.modules.course.infrastructure.persistence.EnrollmentRepository;
import com.paideia.backend.modules.user.domain.AppUser;
import com.paideia.backend.modules.user.infrastructure.persistence.AppUserRepository;

/**
 * Decides whether a user may open a course.
 *
 * <p>Sources are consulted in a fixed order and the first one that grants access wins:
 * <ol>
 *     <li>global admin account role</li>
 *     <li>active enrollment in the course</li>
 *     <li>effective category role on the course's category chain</li>
 * </ol>
 * An enrollment role is never replaced by a category role, even a higher one.
 */
@Service
@Transactional(readOnly = true)
public class CourseAccessResolver {

    private static final Logger log = LoggerFactory.getLogger(CourseAccessResolver.class);

    private final AppUserRepository appUserRepository;
    private final EnrollmentRepository enrollmentRepository;
    private final CourseRepository courseRepository;
    private final CategoryRoleAssignmentRepository assignmentRepository;
    private final EffectiveCategoryRoleResolver effectiveRoleResolver;
    private final CategoryHierarchyNavigator navigator;

    public CourseAccessResolver(
            AppUserRepository appUserRepository,
            EnrollmentRepository enrollmentRepository,
            CourseRepository courseRepository,
            CategoryRoleAssignmentRepository assignmentRepository,
            EffectiveCategoryRoleResolver effectiveRoleResolver,
            CategoryHierarchyNavigator navigator
    ) {
        this.appUserRepository = appUserRepository;
        this.enrollmentRepository = enrollmentRepository;
        this.courseRepository = courseRepository;
        this.assignmentRepository = assignmentRepository;
        this.effectiveRoleResolver = effectiveRoleResolver;
        this.navigator = navigator;
    }

    public CourseAccessResult checkAccess(Long userId, Long courseId) {
        requireId(userId, "access.user_required", "User ID is required");
        requireId(courseId, "access.course_required", "Course ID is required");

        if (isSystemAdmin(userId)) {
            log.debug("User {} reaches course {} as global admin", userId, courseId);
            return CourseAccessResult.globalAdmin();
        }

        Optional<Enrollment> enrollment = enrollmentRepository.findActiveEnrollment(userId, courseId);
        if (enrollment.isPresent()) {
            log.debug("User {} reaches course {} through enrollment {}", userId, courseId, enrollment.get().getId());
            return CourseAccessResult.enrollment(enrollment.get().getRole());
        }

        Long categoryId = courseRepository.findById(courseId)
                .map(Course::getCategoryId)
                .orElse(null);
        if (categoryId != null) {
            Optional<CategoryRole> categoryRole = effectiveRoleResolver.resolve(userId, categoryId);
            if (categoryRole.isPresent()) {
                log.debug("User {} reaches course {} through category {}", userId, courseId, categoryId);
                return CourseAccessResult.category(categoryRole.get());
            }
        }

        return CourseAccessResult.denied();
    }

    /**
     * Courses the user can see, sorted by course id. Global admins see the whole catalog.
     */
    public List<CourseAccessInfo> getUserAccessibleCourses(Long userId) {
        requireId(userId, "access.user_required", "User ID is required");

        if (isSystemAdmin(userId)) {
            String role = EnrollmentRole.MANAGER.getValue();
            return courseRepository.findAllIds().stream()
                    .map(courseId -> new CourseAccessInfo(courseId, AccessSource.GLOBAL_ADMIN, role, null))
                    .toList();
        }

        Map<Long, CourseAccessInfo> byCourse = new TreeMap<>();
        Map<Long, CategoryRole> categoryRoles = new TreeMap<>();

        for (CategoryRoleAssignment assignment : assignmentRepository.findByUserId(userId)) {
            Set<Long> subtree = navigator.descendantIdsInclusive(assignment.getCategoryId());
            for (Course course : courseRepository.findByCategoryIdIn(subtree)) {
                CategoryRole current = categoryRoles.get(course.getId());
                if (assignment.getRole().outranks(current)) {
                    categoryRoles.put(course.getId(), assignment.getRole());
                    byCourse.put(course.getId(), new CourseAccessInfo(
                            course.getId(),
                            AccessSource.CATEGORY,
                            assignment.getRole().getValue(),
                            assignment.getCategoryId()
                    ));
                }
            }
        }

        for (Enrollment enrollment : enrollmentRepository.findActiveEnrollments(userId)) {
            byCourse.put(enrollment.getCourseId(), new CourseAccessInfo(
                    enrollment.getCourseId(),
                    AccessSource.ENROLLMENT,
                    enrollment.getRole().getValue(),
                    null
            ));
        }

        log.debug("User {} can see {} course(s)", userId, byCourse.size());
        return new ArrayList<>(byCourse.values());
    }

    private boolean isSystemAdmin(Long userId) {
        return appUserRepository.findById(userId)
                .map(AppUser::isSystemAdmin)
                .orElse(false);
    }

    private static void requireId(Long id, String code, String detail) {
        if (id == null) {
            throw new ProblemException(ProblemKind.INVALID_ARGUMENT, code, detail);
        }
    }
}
