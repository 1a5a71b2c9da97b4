package com.paideia.backend.modules.categoryrole.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.paideia.backend.global.error.ProblemException;
import com.paideia.backend.global.error.ProblemKind;
import com.paideia.backend.modules.category.infrastructure.persistence.CourseCategoryRepository;
import com.paideia.backend.modules.categoryrole.domain.CategoryRole;
import com.paideia.backend.modules.categoryrole.domain.CategoryRoleAssignment;
import com.paideia.backend.modules.categoryrole.infrastructure.persistence.CategoryRoleAssignmentRepository;
import com.paideia.backend.modules.user.infrastructure.persistence.AppUserRepository;

/**
 * Stores direct category role grants. A user holds at most one role per category; granting
 * again replaces the existing row.
 */
@Service
@Transactional
public class CategoryRoleService {

    private static final Logger log = LoggerFactory.getLogger(CategoryRoleService.class);

    private final CategoryRoleAssignmentRepository assignmentRepository;
    private final CourseCategoryRepository categoryRepository;
    private final AppUserRepository appUserRepository;
    private final Clock clock;

    public CategoryRoleService(
            CategoryRoleAssignmentRepository assignmentRepository,
            CourseCategoryRepository categoryRepository,
            AppUserRepository appUserRepository,
            Clock clock
    ) {
        this.assignmentRepository = assignmentRepository;
        this.categoryRepository = categoryRepository;
        this.appUserRepository = appUserRepository;
        this.clock = clock;
    }

    public CategoryRoleAssignment assign(AssignCategoryRoleCommand command) {
        requireId(command.userId(), "category_role.user_required", "User ID is required");
        requireId(command.categoryId(), "category_role.category_required", "Category ID is required");
        requireRole(command.role());

        // Grants for one user serialize on the user row, so two grants for the same category
        // cannot both miss the lookup below and collide on insert.
        if (appUserRepository.findByIdForUpdate(command.userId()).isEmpty()) {
            throw new ProblemException(ProblemKind.NOT_FOUND, "category_role.user_not_found",
                    "User " + command.userId() + " does not exist");
        }
        if (!categoryRepository.existsById(command.categoryId())) {
            throw new ProblemException(ProblemKind.NOT_FOUND, "category_role.category_not_found",
                    "Category " + command.categoryId() + " does not exist");
        }

        CategoryRoleAssignment assignment = assignmentRepository
                .findByUserIdAndCategoryId(command.userId(), command.categoryId())
                .orElseGet(() -> {
                    CategoryRoleAssignment created = new CategoryRoleAssignment();
                    created.setUserId(command.userId());
                    created.setCategoryId(command.categoryId());
                    return created;
                });

        assignment.setRole(command.role());
        assignment.setAssignedBy(command.assignedBy());
        assignment.setAssignedAt(OffsetDateTime.now(clock));
        assignment.setNotes(command.notes());

        CategoryRoleAssignment saved = assignmentRepository.save(assignment);
        log.info("Granted {} on category {} to user {} (by {})",
                command.role().getValue(), command.categoryId(), command.userId(), command.assignedBy());
        return saved;
    }

    public void revoke(Long userId, Long categoryId) {
        requireId(userId, "category_role.user_required", "User ID is required");
        requireId(categoryId, "category_role.category_required", "Category ID is required");

        CategoryRoleAssignment assignment = assignmentRepository.findByUserIdAndCategoryId(userId, categoryId)
                .orElseThrow(() -> new ProblemException(ProblemKind.NOT_FOUND, "category_role.assignment_not_found",
                        "No role assignment found for this user and category"));

        assignmentRepository.delete(assignment);
        log.info("Revoked {} on category {} from user {}", assignment.getRole().getValue(), categoryId, userId);
    }

    public CategoryRoleAssignment update(Long assignmentId, CategoryRole newRole) {
        requireId(assignmentId, "category_role.assignment_required", "Assignment ID is required");
        requireRole(newRole);

        CategoryRoleAssignment assignment = assignmentRepository.findById(assignmentId)
                .orElseThrow(() -> new ProblemException(ProblemKind.NOT_FOUND, "category_role.assignment_not_found",
                        "Role assignment " + assignmentId + " does not exist"));

        assignment.setRole(newRole);
        return assignmentRepository.save(assignment);
    }

    @Transactional(readOnly = true)
    public Optional<CategoryRoleAssignment> find(Long userId, Long categoryId) {
        requireId(userId, "category_role.user_required", "User ID is required");
        requireId(categoryId, "category_role.category_required", "Category ID is required");
        return assignmentRepository.findByUserIdAndCategoryId(userId, categoryId);
    }

    @Transactional(readOnly = true)
    public List<CategoryRoleAssignment> listForUser(Long userId) {
        requireId(userId, "category_role.user_required", "User ID is required");
        return assignmentRepository.findByUserId(userId);
    }

    @Transactional(readOnly = true)
    public List<CategoryRoleAssignment> listForCategory(Long categoryId) {
        requireId(categoryId, "category_role.category_required", "Category ID is required");
        return assignmentRepository.findByCategoryId(categoryId);
    }

    /**
     * Role granted directly on the category, ignoring ancestors. With {@code requiredRole} set,
     * only an exact match is returned.
     */
    @Transactional(readOnly = true)
    public Optional<CategoryRole> checkDirectRole(Long userId, Long categoryId, CategoryRole requiredRole) {
        return find(userId, categoryId)
                .map(CategoryRoleAssignment::getRole)
                .filter(role -> requiredRole == null || role == requiredRole);
    }

    private static void requireId(Long id, String code, String detail) {
        if (id == null) {
            throw new ProblemException(ProblemKind.INVALID_ARGUMENT, code, detail);
        }
    }

    private static void requireRole(CategoryRole role) {
        if (role == null) {
            throw new ProblemException(ProblemKind.INVALID_ARGUMENT, "category_role.role_required", "Role is required");
        }
    }

    public record AssignCategoryRoleCommand(
            Long userId,
            Long categoryId,
            CategoryRole role,
            Long assignedBy,
            String notes
    ) {
    }
}
