package com.vidnyan.vetree.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * A module found in one source file.
 * Immutable value object; parents are found by name through the {@link DesignIndex}.
 */
public record ModuleDefinition(
    String name,
    String filePath,
    SourceLocation location,
    List<PortDeclaration> ports,
    List<InstanceReference> instances
) {

    public ModuleDefinition {
        ports = List.copyOf(ports);
        instances = List.copyOf(instances);
    }

    /**
     * Find an instance by its instance name.
     */
    public Optional<InstanceReference> findInstance(String instanceName) {
        return instances.stream()
                .filter(i -> i.instanceName().equals(instanceName))
                .findFirst();
    }

    /**
     * Find a port by name.
     */
    public Optional<PortDeclaration> findPort(String portName) {
        return ports.stream()
                .filter(p -> p.name().equals(portName))
                .findFirst();
    }
}
