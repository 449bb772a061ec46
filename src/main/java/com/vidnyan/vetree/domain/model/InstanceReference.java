package com.vidnyan.vetree.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * A module instantiation inside another module's body.
 * Bindings keep their textual order.
 */
public record InstanceReference(
    String moduleName,
    String instanceName,
    SourceLocation location,
    List<PortBinding> bindings
) {

    public InstanceReference {
        bindings = List.copyOf(bindings);
    }

    public Optional<PortBinding> findBinding(String portName) {
        return bindings.stream()
                .filter(b -> b.portName().equals(portName))
                .findFirst();
    }
}
