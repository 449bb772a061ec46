package com.vidnyan.vetree.domain.hierarchy;

import java.util.Locale;
import java.util.Optional;

/**
 * How the hierarchy treats several definitions sharing one module name.
 */
public enum ResolveStrategy {
    /** Expand every matching definition as its own child. */
    ALL,
    /** Expand only the first definition in discovery order. */
    FIRST;

    /**
     * Parse a configuration value ({@code all} or {@code first}, any case).
     */
    public static Optional<ResolveStrategy> parse(String value) {
        if (value == null) return Optional.empty();
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "all" -> Optional.of(ALL);
            case "first" -> Optional.of(FIRST);
            default -> Optional.empty();
        };
    }
}
