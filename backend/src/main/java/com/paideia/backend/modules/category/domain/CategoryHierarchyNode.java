package com.paideia.backend.modules.category.domain;

import java.util.List;

public record CategoryHierarchyNode(
        Long id,
        String name,
        Long parentId,
        List<CategoryHierarchyNode> children
) {

    public CategoryHierarchyNode {
        children = List.copyOf(children);
    }
}
