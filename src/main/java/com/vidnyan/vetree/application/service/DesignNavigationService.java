package com.vidnyan.vetree.application.service;

import com.vidnyan.vetree.IndexProperties;
import com.vidnyan.vetree.application.port.in.IndexDesignUseCase;
import com.vidnyan.vetree.application.port.in.NavigateDesignUseCase;
import com.vidnyan.vetree.domain.connection.ConnectionAnalyzer;
import com.vidnyan.vetree.domain.connection.ConnectionMatch;
import com.vidnyan.vetree.domain.hierarchy.HierarchyBuilder;
import com.vidnyan.vetree.domain.hierarchy.HierarchyForest;
import com.vidnyan.vetree.domain.model.DesignIndex;
import com.vidnyan.vetree.domain.model.ModuleDefinition;
import com.vidnyan.vetree.domain.model.SourceLocation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Answers hierarchy, connection and lookup queries against the current index.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DesignNavigationService implements NavigateDesignUseCase {

    private final IndexDesignUseCase indexDesignUseCase;
    private final IndexProperties properties;

    @Override
    public HierarchyForest hierarchy() {
        DesignIndex index = indexDesignUseCase.currentIndex().orElse(null);
        if (index == null) {
            return HierarchyForest.empty();
        }
        if (properties.hierarchyOptions().hasTopModule() && !index.isDefined(properties.hierarchyOptions().topModule())) {
            log.warn("Top module '{}' is not defined, showing all roots", properties.getHierarchyTopModule());
        }
        HierarchyForest forest = HierarchyBuilder.build(index, properties.hierarchyOptions());
        logStats(forest);
        return forest;
    }

    @Override
    public HierarchyForest hierarchyFrom(String moduleName) {
        DesignIndex index = indexDesignUseCase.currentIndex().orElse(null);
        HierarchyForest forest = HierarchyBuilder.buildFrom(index, moduleName, properties.hierarchyOptions());
        logStats(forest);
        return forest;
    }

    @Override
    public List<String> roots() {
        return indexDesignUseCase.currentIndex()
                .map(index -> HierarchyBuilder.selectRoots(index, properties.hierarchyOptions()))
                .orElse(List.of());
    }

    @Override
    public List<ConnectionMatch> connections(String parentModule, String leftInstance, String rightInstance) {
        List<ConnectionMatch> matches = ConnectionAnalyzer.findDirectConnections(
                indexDesignUseCase.currentIndex().orElse(null), parentModule, leftInstance, rightInstance);
        log.debug("{} shared nets between {}.{} and {}.{}",
                matches.size(), parentModule, leftInstance, parentModule, rightInstance);
        return matches;
    }

    @Override
    public List<SourceLocation> findDefinitions(String word) {
        List<SourceLocation> locations = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (ModuleDefinition module : findModules(word)) {
            SourceLocation location = module.location();
            if (seen.add(location.format())) {
                locations.add(location);
            }
        }
        return locations;
    }

    @Override
    public List<ModuleDefinition> findModules(String name) {
        return indexDesignUseCase.currentIndex()
                .map(index -> index.findModules(name))
                .orElse(List.of());
    }

    @Override
    public Optional<ModulePorts> modulePorts(String moduleName, String filePath) {
        List<ModuleDefinition> variants = findModules(moduleName);
        if (variants.isEmpty()) {
            return Optional.empty();
        }

        Optional<ModuleDefinition> selected = filePath == null || filePath.isBlank()
                ? Optional.of(variants.get(0))
                : variants.stream().filter(m -> m.filePath().equals(filePath)).findFirst();

        List<String> variantFiles = variants.stream().map(ModuleDefinition::filePath).toList();
        return selected.map(m -> new ModulePorts(m.name(), m.filePath(), m.location(), m.ports(), variantFiles));
    }

    @Override
    public Map<String, List<ModuleDefinition>> modulesByFile() {
        return indexDesignUseCase.currentIndex()
                .map(DesignIndex::modulesByFile)
                .orElse(Map.of());
    }

    @Override
    public Map<String, List<String>> duplicates() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        indexDesignUseCase.currentIndex().ifPresent(index ->
                index.duplicateNames().forEach(name -> result.put(name,
                        index.findModules(name).stream().map(ModuleDefinition::filePath).toList())));
        return result;
    }

    private void logStats(HierarchyForest forest) {
        HierarchyForest.Stats stats = forest.stats();
        log.info("Built hierarchy: {} roots, {} nodes, max depth {}, {} depth-limit hits, {} cycles, {} external",
                forest.roots().size(), stats.nodeCount(), stats.maxDepthReached(),
                stats.depthLimitHits(), stats.cycleHits(), stats.externalHits());
    }
}
