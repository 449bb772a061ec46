package com.vidnyan.vetree.domain.model;

/**
 * Named port connection {@code .portName(expr)} inside an instantiation.
 */
public record PortBinding(
    String portName,
    String expression,
    SourceLocation location
) {

    /**
     * Expression with all whitespace removed, used to compare nets.
     */
    public String normalizedExpression() {
        return expression.replaceAll("\\s+", "");
    }

    public boolean isUnconnected() {
        return expression.isBlank();
    }
}
