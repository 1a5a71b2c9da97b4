package com.paideia.backend.modules.category.application;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.paideia.backend.global.error.ProblemException;
import com.paideia.backend.global.error.ProblemKind;
import com.paideia.backend.modules.category.domain.CourseCategory;
import com.paideia.backend.modules.category.infrastructure.persistence.CourseCategoryRepository;

/**
 * Iterative walks over the persisted parent links. Every walk keeps a visited set, so a
 * corrupted chain ends the walk instead of looping.
 */
@Component
public class CategoryHierarchyNavigator {

    private static final Logger log = LoggerFactory.getLogger(CategoryHierarchyNavigator.class);

    private final CourseCategoryRepository categoryRepository;

    public CategoryHierarchyNavigator(CourseCategoryRepository categoryRepository) {
        this.categoryRepository = categoryRepository;
    }

    /**
     * Returns the category followed by its ancestors, nearest first.
     */
    public List<CourseCategory> pathToRoot(Long categoryId) {
        CourseCategory current = categoryRepository.findById(categoryId)
                .orElseThrow(() -> new ProblemException(ProblemKind.NOT_FOUND, "category.not_found",
                        "Category " + categoryId + " does not exist"));

        List<CourseCategory> path = new ArrayList<>();
        Set<Long> visited = new HashSet<>();
        while (current != null) {
            if (!visited.add(current.getId())) {
                log.warn("Category {} is its own ancestor; parent chain from {} truncated", current.getId(), categoryId);
                break;
            }
            path.add(current);
            Long parentId = current.getParentId();
            if (parentId == null) {
                break;
            }
            current = categoryRepository.findById(parentId).orElse(null);
            if (current == null) {
                log.warn("Category chain from {} points at missing parent {}", categoryId, parentId);
            }
        }
        return path;
    }

    public int depthOf(Long categoryId) {
        return pathToRoot(categoryId).size() - 1;
    }

    /**
     * Row-locks the category, every ancestor and {@code alsoLock}, then returns the ids from the
     * category up to its root as committed while the locks are held, nearest first.
     *
     * <p>Structural mutations go through here before checking cycles or depth, so two moves
     * touching the same chain run one after the other. Locks are taken in id order; an ancestor
     * that only shows up after locking (the chain moved meanwhile) is locked in a follow-up round.
     */
    public List<Long> lockPathToRoot(Long categoryId, Long alsoLock) {
        Set<Long> toLock = new TreeSet<>();
        pathToRoot(categoryId).forEach(category -> toLock.add(category.getId()));
        if (alsoLock != null) {
            toLock.add(alsoLock);
        }

        Map<Long, Long> parentLinks = new HashMap<>();
        Set<Long> requested = new HashSet<>();
        List<Long> path = List.of();
        while (!toLock.isEmpty()) {
            requested.addAll(toLock);
            for (Object[] row : categoryRepository.lockParentLinks(List.copyOf(toLock))) {
                Long id = ((Number) row[0]).longValue();
                Long parentId = row[1] != null ? ((Number) row[1]).longValue() : null;
                parentLinks.put(id, parentId);
            }
            if (!parentLinks.containsKey(categoryId)) {
                throw new ProblemException(ProblemKind.NOT_FOUND, "category.not_found",
                        "Category " + categoryId + " does not exist");
            }

            path = lockedPath(categoryId, parentLinks);
            toLock.clear();
            Long next = parentLinks.get(path.get(path.size() - 1));
            if (next != null && !requested.contains(next)) {
                toLock.add(next);
            }
        }
        return path;
    }

    /**
     * Number of levels below the category; a leaf has height 0.
     */
    public int subtreeHeight(Long categoryId) {
        return levelsBelow(categoryId).size();
    }

    public Set<Long> descendantIdsInclusive(Long categoryId) {
        Set<Long> ids = new LinkedHashSet<>();
        ids.add(categoryId);
        levelsBelow(categoryId).forEach(ids::addAll);
        return ids;
    }

    private List<Long> lockedPath(Long categoryId, Map<Long, Long> parentLinks) {
        List<Long> path = new ArrayList<>();
        Set<Long> visited = new HashSet<>();
        Long current = categoryId;
        while (current != null && parentLinks.containsKey(current)) {
            if (!visited.add(current)) {
                log.warn("Category {} is its own ancestor; locked chain from {} truncated", current, categoryId);
                break;
            }
            path.add(current);
            current = parentLinks.get(current);
        }
        return path;
    }

    private List<Set<Long>> levelsBelow(Long categoryId) {
        Set<Long> visited = new HashSet<>();
        visited.add(categoryId);
        List<Set<Long>> levels = new ArrayList<>();
        Set<Long> frontier = Set.of(categoryId);
        while (!frontier.isEmpty()) {
            Set<Long> next = new LinkedHashSet<>();
            for (Long childId : categoryRepository.findChildIds(frontier)) {
                if (visited.add(childId)) {
                    next.add(childId);
                }
            }
            if (!next.isEmpty()) {
                levels.add(next);
            }
            frontier = next;
        }
        return levels;
    }
}
