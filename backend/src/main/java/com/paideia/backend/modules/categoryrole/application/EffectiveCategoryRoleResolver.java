package com.paideia.backend.modules.categoryrole.application;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.paideia.backend.global.error.ProblemException;
import com.paideia.backend.global.error.ProblemKind;
import com.paideia.backend.modules.category.application.CategoryHierarchyNavigator;
import com.paideia.backend.modules.category.domain.CourseCategory;
import com.paideia.backend.modules.categoryrole.domain.CategoryRole;
import com.paideia.backend.modules.categoryrole.domain.CategoryRoleAssignment;
import com.paideia.backend.modules.categoryrole.infrastructure.persistence.CategoryRoleAssignmentRepository;

/**
 * Resolves the role a user effectively holds on a category: the highest-ranked grant on the
 * category or any of its ancestors. Distance does not matter, only rank.
 */
@Component
public class EffectiveCategoryRoleResolver {

    private static final Logger log = LoggerFactory.getLogger(EffectiveCategoryRoleResolver.class);

    private final CategoryHierarchyNavigator navigator;
    private final CategoryRoleAssignmentRepository assignmentRepository;

    public EffectiveCategoryRoleResolver(
            CategoryHierarchyNavigator navigator,
            CategoryRoleAssignmentRepository assignmentRepository
    ) {
        this.navigator = navigator;
        this.assignmentRepository = assignmentRepository;
    }

    @Transactional(readOnly = true)
    public Optional<CategoryRole> resolve(Long userId, Long categoryId) {
        if (userId == null || categoryId == null) {
            throw new ProblemException(ProblemKind.INVALID_ARGUMENT, "category_role.id_required",
                    "User ID and category ID are required");
        }
        List<Long> chain = navigator.pathToRoot(categoryId).stream()
                .map(CourseCategory::getId)
                .toList();

        CategoryRole highest = null;
        for (CategoryRoleAssignment assignment : assignmentRepository.findByUserIdAndCategoryIds(userId, chain)) {
            if (assignment.getRole().outranks(highest)) {
                highest = assignment.getRole();
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("Effective role of user {} on category {} over {} level(s): {}",
                    userId, categoryId, chain.size(), highest != null ? highest.getValue() : "none");
        }
        return Optional.ofNullable(highest);
    }
}
