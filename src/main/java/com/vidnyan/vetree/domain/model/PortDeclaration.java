package com.vidnyan.vetree.domain.model;

/**
 * A port declared in a module header.
 *
 * @param rangeText bit range as written, e.g. {@code [7:0]}; null when absent
 */
public record PortDeclaration(
    PortDirection direction,
    String name,
    String rangeText,
    SourceLocation location
) {

    public boolean hasRange() {
        return rangeText != null;
    }
}
