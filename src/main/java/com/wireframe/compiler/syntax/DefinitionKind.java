package com.wireframe.compiler.syntax;

/**
 * The two forms of user definitions.
 */
public enum DefinitionKind {
    /** {@code define Component "Name" { ... }}, invoked as a component. */
    COMPONENT,
    /** {@code define Layout "name" { ... }}, invoked as a layout with exactly one child. */
    LAYOUT;

    public String tag() {
        return name().toLowerCase();
    }
}
