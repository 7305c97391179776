package com.wireframe.compiler.ir.model;

import java.util.Locale;

/**
 * Kind tag of an IR node. The tag is also the prefix of every generated node id.
 */
public enum NodeKind {
    CONTAINER,
    COMPONENT,
    INSTANCE;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
