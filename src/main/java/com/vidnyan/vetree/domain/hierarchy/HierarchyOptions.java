package com.vidnyan.vetree.domain.hierarchy;

/**
 * Settings for one hierarchy build.
 *
 * @param topModule restricts the roots to this module when it is defined; blank for none
 */
public record HierarchyOptions(
    int maxDepth,
    ResolveStrategy resolve,
    String topModule
) {

    public static final int DEFAULT_MAX_DEPTH = 32;

    public static HierarchyOptions defaults() {
        return new HierarchyOptions(DEFAULT_MAX_DEPTH, ResolveStrategy.ALL, "");
    }

    public boolean hasTopModule() {
        return topModule != null && !topModule.isBlank();
    }

    public HierarchyOptions withMaxDepth(int depth) {
        return new HierarchyOptions(depth, resolve, topModule);
    }

    public HierarchyOptions withResolve(ResolveStrategy strategy) {
        return new HierarchyOptions(maxDepth, strategy, topModule);
    }

    public HierarchyOptions withTopModule(String name) {
        return new HierarchyOptions(maxDepth, resolve, name);
    }
}
