package com.wireframe.compiler.ir.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of structural containers.
 */
public enum ContainerType {
    STACK,
    GRID,
    SPLIT,
    PANEL,
    CARD;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ContainerType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (ContainerType type : values()) {
            if (type.tag().equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
