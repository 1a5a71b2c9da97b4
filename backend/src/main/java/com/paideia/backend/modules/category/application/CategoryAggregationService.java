package com.paideia.backend.modules.category.application;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.paideia.backend.global.error.ProblemException;
import com.paideia.backend.global.error.ProblemKind;
import com.paideia.backend.modules.category.domain.CategoryTreeNode;
import com.paideia.backend.modules.category.domain.CourseCategory;
import com.paideia.backend.modules.category.infrastructure.persistence.CourseCategoryRepository;
import com.paideia.backend.modules.course.infrastructure.persistence.CourseRepository;

/**
 * Course and subcategory counts derived from the current category forest and course catalog.
 * Nothing is cached; every call reads committed state.
 */
@Service
@Transactional(readOnly = true)
public class CategoryAggregationService {

    private static final Logger log = LoggerFactory.getLogger(CategoryAggregationService.class);

    private final CourseCategoryRepository categoryRepository;
    private final CourseRepository courseRepository;
    private final CategoryHierarchyNavigator navigator;

    public CategoryAggregationService(
            CourseCategoryRepository categoryRepository,
            CourseRepository courseRepository,
            CategoryHierarchyNavigator navigator
    ) {
        this.categoryRepository = categoryRepository;
        this.courseRepository = courseRepository;
        this.navigator = navigator;
    }

    public long directCoursesCount(Long categoryId) {
        ensureExists(categoryId);
        return courseRepository.countByCategoryId(categoryId);
    }

    public long directSubcategoriesCount(Long categoryId) {
        ensureExists(categoryId);
        return categoryRepository.countByParentId(categoryId);
    }

    /**
     * Courses in the category plus every course anywhere beneath it. Each course has a single
     * category, so summing over the distinct subtree ids counts every course once.
     */
    public long totalNestedCoursesCount(Long categoryId) {
        ensureExists(categoryId);
        Set<Long> subtree = navigator.descendantIdsInclusive(categoryId);
        long total = 0;
        for (Long id : subtree) {
            total += courseRepository.countByCategoryId(id);
        }
        return total;
    }

    public CategoryStats getStats(Long categoryId) {
        return new CategoryStats(
                directCoursesCount(categoryId),
                directSubcategoriesCount(categoryId),
                totalNestedCoursesCount(categoryId)
        );
    }

    /**
     * Full forest with counts on every node, computed in a single children-first pass.
     */
    public List<CategoryTreeNode> buildTree() {
        CategoryForest forest = CategoryForest.of(categoryRepository.findAllOrderByName());
        Map<Long, Long> directCourses = directCourseCounts();

        Map<Long, CategoryTreeNode> built = new HashMap<>();
        List<CourseCategory> ordered = forest.childrenFirstOrder();
        for (CourseCategory category : ordered) {
            List<CourseCategory> children = forest.childrenOf(category.getId());
            List<CategoryTreeNode> childNodes = children.stream()
                    .map(child -> built.get(child.getId()))
                    .filter(Objects::nonNull)
                    .toList();
            long direct = directCourses.getOrDefault(category.getId(), 0L);
            long nested = childNodes.stream().mapToLong(CategoryTreeNode::totalNestedCoursesCount).sum();
            built.put(category.getId(), new CategoryTreeNode(
                    category.getId(),
                    category.getName(),
                    category.getParentId(),
                    direct,
                    children.size(),
                    direct + nested,
                    childNodes
            ));
        }

        if (ordered.size() < forest.size()) {
            log.warn("Category tree skipped {} categories without a path to a root", forest.size() - ordered.size());
        }
        log.debug("Built category tree with {} nodes", ordered.size());

        return forest.roots().stream()
                .map(root -> built.get(root.getId()))
                .toList();
    }

    private Map<Long, Long> directCourseCounts() {
        Map<Long, Long> counts = new HashMap<>();
        for (Object[] row : courseRepository.countGroupedByCategory()) {
            counts.put(((Number) row[0]).longValue(), ((Number) row[1]).longValue());
        }
        return counts;
    }

    private void ensureExists(Long categoryId) {
        if (categoryId == null) {
            throw new ProblemException(ProblemKind.INVALID_ARGUMENT, "category.id_required", "Category ID is required");
        }
        if (!categoryRepository.existsById(categoryId)) {
            throw new ProblemException(ProblemKind.NOT_FOUND, "category.not_found",
                    "Category " + categoryId + " does not exist");
        }
    }

    public record CategoryStats(
            long directCoursesCount,
            long directSubcategoriesCount,
            long totalNestedCoursesCount
    ) {
    }
}
