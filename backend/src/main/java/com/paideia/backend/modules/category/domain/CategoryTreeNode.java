package com.paideia.backend.modules.category.domain;

import java.util.List;

/**
 * Category annotated with its course and subcategory counts, as rendered in the admin tree.
 */
public record CategoryTreeNode(
        Long id,
        String name,
        Long parentId,
        long directCoursesCount,
        long directSubcategoriesCount,
        long totalNestedCoursesCount,
        List<CategoryTreeNode> subcategories
) {

    public CategoryTreeNode {
        subcategories = List.copyOf(subcategories);
    }
}
