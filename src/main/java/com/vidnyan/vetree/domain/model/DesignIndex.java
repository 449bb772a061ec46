package com.vidnyan.vetree.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of every module found by one full scan.
 * Immutable aggregate root. Lookup lists keep discovery order; several entries under one
 * name are duplicate definitions, which is a normal condition.
 */
public record DesignIndex(
    List<ModuleDefinition> modules,
    Map<String, List<ModuleDefinition>> modulesByName,
    Map<String, List<ModuleDefinition>> modulesByFile
) {

    private static final DesignIndex EMPTY = of(List.of());

    public static DesignIndex empty() {
        return EMPTY;
    }

    /**
     * Group an ordered module list into the name and file lookups.
     */
    public static DesignIndex of(List<ModuleDefinition> modules) {
        Map<String, List<ModuleDefinition>> byName = new LinkedHashMap<>();
        Map<String, List<ModuleDefinition>> byFile = new LinkedHashMap<>();

        for (ModuleDefinition module : modules) {
            byName.computeIfAbsent(module.name(), k -> new ArrayList<>()).add(module);
            byFile.computeIfAbsent(module.filePath(), k -> new ArrayList<>()).add(module);
        }

        return new DesignIndex(
                List.copyOf(modules),
                freeze(byName),
                freeze(byFile));
    }

    private static Map<String, List<ModuleDefinition>> freeze(Map<String, List<ModuleDefinition>> source) {
        Map<String, List<ModuleDefinition>> copy = new LinkedHashMap<>();
        source.forEach((key, list) -> copy.put(key, List.copyOf(list)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * All definitions sharing a name, in discovery order.
     */
    public List<ModuleDefinition> findModules(String name) {
        return modulesByName.getOrDefault(name, List.of());
    }

    public boolean isDefined(String name) {
        return !findModules(name).isEmpty();
    }

    /**
     * Modules declared in one file.
     */
    public List<ModuleDefinition> modulesInFile(String filePath) {
        return modulesByFile.getOrDefault(filePath, List.of());
    }

    /**
     * Names with more than one definition.
     */
    public List<String> duplicateNames() {
        return modulesByName.entrySet().stream()
                .filter(e -> e.getValue().size() > 1)
                .map(Map.Entry::getKey)
                .toList();
    }

    public boolean isEmpty() {
        return modules.isEmpty();
    }

    /**
     * Get statistics.
     */
    public Stats stats() {
        return new Stats(
                modules.size(),
                modulesByName.size(),
                modulesByFile.size(),
                modules.stream().mapToInt(m -> m.instances().size()).sum(),
                modules.stream().mapToInt(m -> m.ports().size()).sum(),
                duplicateNames().size()
        );
    }

    public record Stats(
        int moduleCount,
        int distinctNameCount,
        int fileCount,
        int instanceCount,
        int portCount,
        int duplicateNameCount
    ) {}
}
