package com.vidnyan.vetree.application.port.in;

import com.vidnyan.vetree.domain.connection.ConnectionMatch;
import com.vidnyan.vetree.domain.hierarchy.HierarchyForest;
import com.vidnyan.vetree.domain.model.ModuleDefinition;
import com.vidnyan.vetree.domain.model.PortDeclaration;
import com.vidnyan.vetree.domain.model.SourceLocation;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Queries over the current design index. Every query answers with empty data before the
 * first scan.
 */
public interface NavigateDesignUseCase {

    /**
     * Instantiation forest built with the configured options.
     */
    HierarchyForest hierarchy();

    /**
     * Instantiation tree rooted at one module.
     */
    HierarchyForest hierarchyFrom(String moduleName);

    List<String> roots();

    /**
     * Nets shared by two sibling instances of a parent module.
     */
    List<ConnectionMatch> connections(String parentModule, String leftInstance, String rightInstance);

    /**
     * Definition locations of every module with this name, without repeats.
     */
    List<SourceLocation> findDefinitions(String word);

    List<ModuleDefinition> findModules(String name);

    /**
     * Ports of one module definition. {@code filePath} selects a variant when several files
     * define the name; null picks the first.
     */
    Optional<ModulePorts> modulePorts(String moduleName, String filePath);

    /**
     * File identity to the modules it declares.
     */
    Map<String, List<ModuleDefinition>> modulesByFile();

    /**
     * Module names with several definitions, mapped to the defining files.
     */
    Map<String, List<String>> duplicates();

    record ModulePorts(
        String moduleName,
        String filePath,
        SourceLocation location,
        List<PortDeclaration> ports,
        List<String> variants
    ) {}
}
