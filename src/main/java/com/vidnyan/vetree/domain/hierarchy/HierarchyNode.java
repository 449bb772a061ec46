package com.vidnyan.vetree.domain.hierarchy;

import com.vidnyan.vetree.domain.model.SourceLocation;

import java.util.List;

/**
 * One node of an instantiation tree. Built fresh for every hierarchy build.
 *
 * @param instanceName null for root nodes
 * @param definitionLocation null for external modules
 * @param instanceLocation null for root nodes
 */
public record HierarchyNode(
    String moduleName,
    String label,
    String instanceName,
    NodeKind kind,
    SourceLocation definitionLocation,
    SourceLocation instanceLocation,
    List<HierarchyNode> children
) {

    public enum NodeKind {
        MODULE,
        CYCLE,
        DEPTH_LIMIT,
        EXTERNAL
    }

    public HierarchyNode {
        children = List.copyOf(children);
    }

    public boolean isTerminal() {
        return kind != NodeKind.MODULE;
    }

    /**
     * Where a consumer should jump: the instantiation when known, else the definition.
     */
    public SourceLocation navigationTarget() {
        return instanceLocation != null ? instanceLocation : definitionLocation;
    }
}
