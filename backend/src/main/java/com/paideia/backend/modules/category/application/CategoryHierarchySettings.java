package com.paideia.backend.modules.category.application;

/**
 * Structural limits of the category forest.
 *
 * @param maxDepth number of levels allowed (a root alone is one level), or {@code null} when unlimited
 */
public record CategoryHierarchySettings(Integer maxDepth) {

    public CategoryHierarchySettings {
        if (maxDepth != null && maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive when set");
        }
    }

    public static CategoryHierarchySettings unlimited() {
        return new CategoryHierarchySettings(null);
    }

    public static CategoryHierarchySettings withMaxDepth(int maxDepth) {
        return new CategoryHierarchySettings(maxDepth);
    }

    public boolean isDepthLimited() {
        return maxDepth != null;
    }

    /**
     * Whether a node at {@code depth} (root = 0) with {@code subtreeHeight} levels beneath it fits.
     */
    public boolean allows(int depth, int subtreeHeight) {
        return !isDepthLimited() || depth + subtreeHeight < maxDepth;
    }
}
