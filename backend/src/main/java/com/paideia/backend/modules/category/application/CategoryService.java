package com.paideia.backend.modules.category.application;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.paideia.backend.global.error.ProblemException;
import com.paideia.backend.global.error.ProblemKind;
import com.paideia.backend.modules.category.domain.CategoryHierarchyNode;
import com.paideia.backend.modules.category.domain.CourseCategory;
import com.paideia.backend.modules.category.infrastructure.persistence.CourseCategoryRepository;
import com.paideia.backend.modules.categoryrole.infrastructure.persistence.CategoryRoleAssignmentRepository;
import com.paideia.backend.modules.course.infrastructure.persistence.CourseRepository;

/**
 * Owns category identity and parent links, and keeps the forest acyclic and within the
 * configured depth after every mutation.
 */
@Service
@Transactional
public class CategoryService {

    private static final Logger log = LoggerFactory.getLogger(CategoryService.class);

    private final CourseCategoryRepository categoryRepository;
    private final CourseRepository courseRepository;
    private final CategoryRoleAssignmentRepository roleAssignmentRepository;
    private final CategoryHierarchyNavigator navigator;
    private final CategoryHierarchySettings settings;

    public CategoryService(
            CourseCategoryRepository categoryRepository,
            CourseRepository courseRepository,
            CategoryRoleAssignmentRepository roleAssignmentRepository,
            CategoryHierarchyNavigator navigator,
            CategoryHierarchySettings settings
    ) {
        this.categoryRepository = categoryRepository;
        this.courseRepository = courseRepository;
        this.roleAssignmentRepository = roleAssignmentRepository;
        this.navigator = navigator;
        this.settings = settings;
    }

    public CourseCategory create(String name, Long parentId) {
        String normalizedName = requireName(name);

        CourseCategory parent = null;
        if (parentId != null) {
            parent = findParent(parentId);
            ensureDepthAllowed(navigator.lockPathToRoot(parentId, null).size(), 0);
        }

        CourseCategory category = new CourseCategory();
        category.setName(normalizedName);
        category.setParent(parent);
        CourseCategory saved = categoryRepository.save(category);
        log.info("Created category {} '{}' under {}", saved.getId(), normalizedName, parentId);
        return saved;
    }

    /**
     * Structural changes lock the affected rows before any check, and the new name is applied
     * last so nothing is flushed ahead of those locks.
     */
    public CourseCategory update(Long categoryId, UpdateCategoryCommand command) {
        CourseCategory category = getCategory(categoryId);
        if (command == null) {
            throw new ProblemException(ProblemKind.INVALID_ARGUMENT, "category.update_required",
                    "Update command is required");
        }

        String newName = command.name() != null ? requireName(command.name()) : null;

        if (command.moveToRoot() && command.parentId() != null) {
            throw new ProblemException(ProblemKind.INVALID_ARGUMENT, "category.conflicting_parent_change",
                    "A category cannot be moved to the root and under a parent at the same time");
        }

        if (command.moveToRoot()) {
            navigator.lockPathToRoot(categoryId, null);
            ensureDepthAllowed(0, navigator.subtreeHeight(categoryId));
            category.setParent(null);
            log.info("Moved category {} to the root level", categoryId);
        } else if (command.parentId() != null) {
            reparent(category, command.parentId());
        }

        if (newName != null) {
            category.setName(newName);
        }
        return categoryRepository.save(category);
    }

    /**
     * Deletes an empty category. The row lock serializes this with concurrent course
     * reassignments, which need a key-share lock on the same row.
     */
    public void delete(Long categoryId) {
        requireId(categoryId);
        CourseCategory category = categoryRepository.findByIdForUpdate(categoryId)
                .orElseThrow(() -> notFound(categoryId));

        if (categoryRepository.existsByParentId(categoryId)) {
            throw new ProblemException(ProblemKind.HAS_SUBCATEGORIES, "category.has_subcategories",
                    "Cannot delete category with subcategories. Delete subcategories first.");
        }
        if (courseRepository.existsByCategoryId(categoryId)) {
            throw new ProblemException(ProblemKind.HAS_COURSES, "category.has_courses",
                    "Cannot delete category with courses. Remove or reassign courses first.");
        }

        int removedAssignments = roleAssignmentRepository.deleteByCategoryId(categoryId);
        categoryRepository.delete(category);
        log.info("Deleted category {} and {} role assignment(s)", categoryId, removedAssignments);
    }

    @Transactional(readOnly = true)
    public Optional<CourseCategory> findById(Long categoryId) {
        requireId(categoryId);
        return categoryRepository.findById(categoryId);
    }

    @Transactional(readOnly = true)
    public CourseCategory getCategory(Long categoryId) {
        requireId(categoryId);
        return categoryRepository.findById(categoryId)
                .orElseThrow(() -> notFound(categoryId));
    }

    @Transactional(readOnly = true)
    public List<CourseCategory> findRoots() {
        return categoryRepository.findRoots();
    }

    @Transactional(readOnly = true)
    public List<CourseCategory> findChildren(Long parentId) {
        if (parentId == null) {
            throw new ProblemException(ProblemKind.INVALID_ARGUMENT, "category.parent_required", "Parent ID is required");
        }
        return categoryRepository.findChildren(parentId);
    }

    @Transactional(readOnly = true)
    public List<CourseCategory> findAll() {
        return categoryRepository.findAllOrderByName();
    }

    /**
     * Returns the chain from the root down to the category itself.
     */
    @Transactional(readOnly = true)
    public List<CourseCategory> getAncestors(Long categoryId) {
        requireId(categoryId);
        List<CourseCategory> ancestors = new ArrayList<>(navigator.pathToRoot(categoryId));
        Collections.reverse(ancestors);
        return ancestors;
    }

    @Transactional(readOnly = true)
    public int getDepth(Long categoryId) {
        requireId(categoryId);
        return navigator.depthOf(categoryId);
    }

    @Transactional(readOnly = true)
    public List<CategoryHierarchyNode> getTree() {
        CategoryForest forest = CategoryForest.of(categoryRepository.findAllOrderByName());
        Map<Long, CategoryHierarchyNode> built = new HashMap<>();
        List<CourseCategory> ordered = forest.childrenFirstOrder();
        for (CourseCategory category : ordered) {
            List<CategoryHierarchyNode> children = forest.childrenOf(category.getId()).stream()
                    .map(child -> built.get(child.getId()))
                    .filter(Objects::nonNull)
                    .toList();
            built.put(category.getId(), new CategoryHierarchyNode(
                    category.getId(),
                    category.getName(),
                    category.getParentId(),
                    children
            ));
        }
        if (ordered.size() < forest.size()) {
            log.warn("{} categories are not reachable from any root", forest.size() - ordered.size());
        }
        return forest.roots().stream()
                .map(root -> built.get(root.getId()))
                .toList();
    }

    private void reparent(CourseCategory category, Long newParentId) {
        Long categoryId = category.getId();
        if (categoryId.equals(newParentId)) {
            throw new ProblemException(ProblemKind.CIRCULAR_REFERENCE, "category.self_parent",
                    "A category cannot be its own parent");
        }

        CourseCategory newParent = findParent(newParentId);
        List<Long> newParentPath = navigator.lockPathToRoot(newParentId, categoryId);
        if (newParentPath.contains(categoryId)) {
            throw new ProblemException(ProblemKind.CIRCULAR_REFERENCE, "category.circular_reference",
                    "Cannot set parent to a descendant category (circular reference)");
        }

        ensureDepthAllowed(newParentPath.size(), navigator.subtreeHeight(categoryId));
        category.setParent(newParent);
        log.info("Moved category {} under {}", categoryId, newParentId);
    }

    private void ensureDepthAllowed(int depth, int subtreeHeight) {
        if (!settings.allows(depth, subtreeHeight)) {
            throw new ProblemException(ProblemKind.DEPTH_LIMIT_EXCEEDED, "category.depth_limit_exceeded",
                    "Category depth limit exceeded. Maximum allowed depth is " + settings.maxDepth());
        }
    }

    private CourseCategory findParent(Long parentId) {
        return categoryRepository.findById(parentId)
                .orElseThrow(() -> new ProblemException(ProblemKind.NOT_FOUND, "category.parent_not_found",
                        "Parent category " + parentId + " does not exist"));
    }

    private static void requireId(Long categoryId) {
        if (categoryId == null) {
            throw new ProblemException(ProblemKind.INVALID_ARGUMENT, "category.id_required", "Category ID is required");
        }
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ProblemException(ProblemKind.INVALID_ARGUMENT, "category.name_required", "Category name is required");
        }
        return name.trim();
    }

    private static ProblemException notFound(Long categoryId) {
        return new ProblemException(ProblemKind.NOT_FOUND, "category.not_found",
                "Category " + categoryId + " does not exist");
    }

    /**
     * @param name       new name, or {@code null} to keep the current one
     * @param parentId   new parent, or {@code null} to keep the current one
     * @param moveToRoot detach the category from its parent
     */
    public record UpdateCategoryCommand(String name, Long parentId, boolean moveToRoot) {

        public static UpdateCategoryCommand rename(String name) {
            return new UpdateCategoryCommand(name, null, false);
        }

        public static UpdateCategoryCommand moveUnder(Long parentId) {
            return new UpdateCategoryCommand(null, parentId, false);
        }

        public static UpdateCategoryCommand moveToRootLevel() {
            return new UpdateCategoryCommand(null, null, true);
        }
    }
}
