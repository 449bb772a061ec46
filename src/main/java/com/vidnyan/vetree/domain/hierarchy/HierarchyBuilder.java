package com.vidnyan.vetree.domain.hierarchy;

import com.vidnyan.vetree.domain.hierarchy.HierarchyNode.NodeKind;
import com.vidnyan.vetree.domain.model.DesignIndex;
import com.vidnyan.vetree.domain.model.InstanceReference;
import com.vidnyan.vetree.domain.model.ModuleDefinition;
import com.vidnyan.vetree.domain.model.SourceLocation;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns the flat instantiation edges of a {@link DesignIndex} into a rooted tree.
 * <p>
 * Expansion carries a visited set per path, so a module reused in two independent branches
 * is expanded in both, while a module reappearing on its own path becomes a cycle node.
 * Depth is bounded by {@link HierarchyOptions#maxDepth()}. Instances of undefined modules
 * become external nodes. The build is total: every input yields a finite tree.
 */
public final class HierarchyBuilder {

    private final DesignIndex index;
    private final HierarchyOptions options;

    private int nodeCount;
    private int maxDepthReached;
    private int depthLimitHits;
    private int cycleHits;
    private int externalHits;

    private HierarchyBuilder(DesignIndex index, HierarchyOptions options) {
        this.index = index;
        this.options = options;
    }

    /**
     * Build the forest for every root (or the configured top module).
     */
    public static HierarchyForest build(DesignIndex index, HierarchyOptions options) {
        if (index == null) {
            return HierarchyForest.empty();
        }
        List<String> roots = selectRoots(index, options);
        return new HierarchyBuilder(index, options).expandRoots(roots);
    }

    /**
     * Build a single tree rooted at the given module, whether or not it is a root.
     */
    public static HierarchyForest buildFrom(DesignIndex index, String moduleName, HierarchyOptions options) {
        if (index == null || !index.isDefined(moduleName)) {
            return HierarchyForest.empty();
        }
        return new HierarchyBuilder(index, options).expandRoots(List.of(moduleName));
    }

    /**
     * Names never instantiated anywhere in the index, sorted.
     */
    public static List<String> computeRoots(DesignIndex index) {
        if (index == null) {
            return List.of();
        }
        Set<String> instantiated = new HashSet<>();
        for (ModuleDefinition module : index.modules()) {
            for (InstanceReference instance : module.instances()) {
                instantiated.add(instance.moduleName());
            }
        }

        Set<String> roots = new TreeSet<>();
        for (ModuleDefinition module : index.modules()) {
            if (!instantiated.contains(module.name())) {
                roots.add(module.name());
            }
        }
        return List.copyOf(roots);
    }

    /**
     * Roots to expand: the top module alone when it is defined, otherwise all roots.
     */
    public static List<String> selectRoots(DesignIndex index, HierarchyOptions options) {
        if (options.hasTopModule() && index.isDefined(options.topModule().trim())) {
            return List.of(options.topModule().trim());
        }
        return computeRoots(index);
    }

    private HierarchyForest expandRoots(List<String> roots) {
        List<HierarchyNode> trees = new ArrayList<>();
        for (String root : roots) {
            SourceLocation definition = index.findModules(root).get(0).location();
            trees.add(expand(root, root, null, null, definition, Set.of(), 0));
        }
        return new HierarchyForest(
                roots,
                trees,
                new HierarchyForest.Stats(nodeCount, maxDepthReached, depthLimitHits, cycleHits, externalHits));
    }

    private HierarchyNode expand(String name,
                                 String label,
                                 String instanceName,
                                 SourceLocation instanceLocation,
                                 SourceLocation definitionLocation,
                                 Set<String> pathVisited,
                                 int depth) {
        nodeCount++;
        maxDepthReached = Math.max(maxDepthReached, depth);

        if (depth >= options.maxDepth()) {
            depthLimitHits++;
            return terminal(name, label + " (depth limit)", instanceName, NodeKind.DEPTH_LIMIT,
                    definitionLocation, instanceLocation);
        }
        if (pathVisited.contains(name)) {
            cycleHits++;
            return terminal(name, label + " (cycle)", instanceName, NodeKind.CYCLE,
                    definitionLocation, instanceLocation);
        }

        Set<String> visited = new HashSet<>(pathVisited);
        visited.add(name);

        List<HierarchyNode> children = new ArrayList<>();
        // every definition contributes edges; the strategy only limits how targets expand
        for (ModuleDefinition definition : index.findModules(name)) {
            for (InstanceReference instance : definition.instances()) {
                String childLabel = instance.instanceName() + ": " + instance.moduleName();
                List<ModuleDefinition> targets = definitionsToExpand(instance.moduleName());

                if (targets.isEmpty()) {
                    nodeCount++;
                    maxDepthReached = Math.max(maxDepthReached, depth + 1);
                    externalHits++;
                    children.add(terminal(instance.moduleName(), childLabel + " (external)",
                            instance.instanceName(), NodeKind.EXTERNAL, null, instance.location()));
                    continue;
                }

                for (ModuleDefinition target : targets) {
                    children.add(expand(target.name(), childLabel, instance.instanceName(),
                            instance.location(), target.location(), visited, depth + 1));
                }
            }
        }

        return new HierarchyNode(name, label, instanceName, NodeKind.MODULE,
                definitionLocation, instanceLocation, children);
    }

    private List<ModuleDefinition> definitionsToExpand(String name) {
        List<ModuleDefinition> definitions = index.findModules(name);
        if (options.resolve() == ResolveStrategy.FIRST && definitions.size() > 1) {
            return definitions.subList(0, 1);
        }
        return definitions;
    }

    private static HierarchyNode terminal(String name, String label, String instanceName, NodeKind kind,
                                          SourceLocation definitionLocation, SourceLocation instanceLocation) {
        return new HierarchyNode(name, label, instanceName, kind, definitionLocation, instanceLocation, List.of());
    }
}
