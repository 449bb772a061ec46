package com.vidnyan.vetree.domain.connection;

import com.vidnyan.vetree.domain.model.PortBinding;
import com.vidnyan.vetree.domain.model.SourceLocation;

/**
 * Two port bindings, one on each instance, attached to the same net.
 *
 * @param net normalized net expression
 * @param location where to navigate, the left binding
 */
public record ConnectionMatch(
    String net,
    PortBinding left,
    PortBinding right,
    SourceLocation location
) {

    /**
     * Format as {@code left.port <-> right.port : net}.
     */
    public String describe(String leftInstance, String rightInstance) {
        return leftInstance + "." + left.portName() + " <-> "
                + rightInstance + "." + right.portName() + " : " + net;
    }
}
