package com.paideia.backend.modules.category.application;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.paideia.backend.modules.category.domain.CourseCategory;

/**
 * In-memory view of a full category snapshot, used to assemble trees in one pass.
 */
final class CategoryForest {

    private final List<CourseCategory> roots = new ArrayList<>();
    private final Map<Long, List<CourseCategory>> childrenByParent = new LinkedHashMap<>();
    private final int size;

    private CategoryForest(List<CourseCategory> categories) {
        this.size = categories.size();
        for (CourseCategory category : categories) {
            if (category.getParentId() == null) {
                roots.add(category);
            } else {
                childrenByParent.computeIfAbsent(category.getParentId(), key -> new ArrayList<>()).add(category);
            }
        }
    }

    /**
     * Categories keep the order they are given in, so pass them sorted.
     */
    static CategoryForest of(List<CourseCategory> categories) {
        return new CategoryForest(categories);
    }

    List<CourseCategory> roots() {
        return Collections.unmodifiableList(roots);
    }

    List<CourseCategory> childrenOf(Long categoryId) {
        return childrenByParent.getOrDefault(categoryId, List.of());
    }

    int size() {
        return size;
    }

    /**
     * Every category reachable from a root, each one listed after all of its descendants.
     */
    List<CourseCategory> childrenFirstOrder() {
        List<CourseCategory> preorder = new ArrayList<>();
        Set<Long> visited = new HashSet<>();
        Deque<CourseCategory> stack = new ArrayDeque<>(roots);
        while (!stack.isEmpty()) {
            CourseCategory current = stack.pop();
            if (!visited.add(current.getId())) {
                continue;
            }
            preorder.add(current);
            childrenOf(current.getId()).forEach(stack::push);
        }
        Collections.reverse(preorder);
        return preorder;
    }
}
