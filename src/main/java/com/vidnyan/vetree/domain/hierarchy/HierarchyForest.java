package com.vidnyan.vetree.domain.hierarchy;

import java.util.List;

/**
 * Result of one hierarchy build: the root names, one tree per root, and build statistics.
 */
public record HierarchyForest(
    List<String> roots,
    List<HierarchyNode> trees,
    Stats stats
) {

    public static HierarchyForest empty() {
        return new HierarchyForest(List.of(), List.of(), new Stats(0, 0, 0, 0, 0));
    }

    public boolean isEmpty() {
        return trees.isEmpty();
    }

    /**
     * Diagnostics only; never used for decisions.
     */
    public record Stats(
        int nodeCount,
        int maxDepthReached,
        int depthLimitHits,
        int cycleHits,
        int externalHits
    ) {}
}
