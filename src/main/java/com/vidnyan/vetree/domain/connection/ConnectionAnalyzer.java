package com.vidnyan.vetree.domain.connection;

import com.vidnyan.vetree.domain.model.DesignIndex;
import com.vidnyan.vetree.domain.model.InstanceReference;
import com.vidnyan.vetree.domain.model.ModuleDefinition;
import com.vidnyan.vetree.domain.model.PortBinding;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds nets shared by two sibling instances of one parent module.
 * Nets are compared by their whitespace-free expression text; fan-out yields one match per
 * pair of bindings.
 */
public final class ConnectionAnalyzer {

    private ConnectionAnalyzer() {
    }

    /**
     * Shared nets between {@code leftInstance} and {@code rightInstance} inside the first
     * definition of {@code parentModule} that contains both. Empty when no such module exists.
     */
    public static List<ConnectionMatch> findDirectConnections(DesignIndex index,
                                                              String parentModule,
                                                              String leftInstance,
                                                              String rightInstance) {
        if (index == null) {
            return List.of();
        }
        for (ModuleDefinition parent : index.findModules(parentModule)) {
            Optional<InstanceReference> left = parent.findInstance(leftInstance);
            Optional<InstanceReference> right = parent.findInstance(rightInstance);
            if (left.isPresent() && right.isPresent()) {
                return match(left.get(), right.get());
            }
        }
        return List.of();
    }

    /**
     * Shared nets between two instances.
     */
    public static List<ConnectionMatch> match(InstanceReference left, InstanceReference right) {
        Map<String, List<PortBinding>> leftNets = netsOf(left);
        Map<String, List<PortBinding>> rightNets = netsOf(right);

        List<ConnectionMatch> matches = new ArrayList<>();
        leftNets.forEach((net, leftBindings) -> {
            List<PortBinding> rightBindings = rightNets.get(net);
            if (rightBindings == null) {
                return;
            }
            for (PortBinding l : leftBindings) {
                for (PortBinding r : rightBindings) {
                    matches.add(new ConnectionMatch(net, l, r, l.location()));
                }
            }
        });
        return matches;
    }

    private static Map<String, List<PortBinding>> netsOf(InstanceReference instance) {
        Map<String, List<PortBinding>> nets = new LinkedHashMap<>();
        for (PortBinding binding : instance.bindings()) {
            if (binding.isUnconnected()) {
                continue;
            }
            nets.computeIfAbsent(binding.normalizedExpression(), k -> new ArrayList<>()).add(binding);
        }
        return nets;
    }
}
