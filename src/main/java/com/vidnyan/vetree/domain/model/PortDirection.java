package com.vidnyan.vetree.domain.model;

import java.util.Locale;

/**
 * Direction keyword of a port declaration.
 */
public enum PortDirection {
    INPUT,
    OUTPUT,
    INOUT,
    REF,
    UNKNOWN;

    public static PortDirection fromKeyword(String keyword) {
        if (keyword == null) return UNKNOWN;
        return switch (keyword.toLowerCase(Locale.ROOT)) {
            case "input" -> INPUT;
            case "output" -> OUTPUT;
            case "inout" -> INOUT;
            case "ref" -> REF;
            default -> UNKNOWN;
        };
    }
}
