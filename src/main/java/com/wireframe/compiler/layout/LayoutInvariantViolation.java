package com.wireframe.compiler.layout;

/**
 * Internal guard for impossible geometry. The engine clamps sizes before building boxes,
 * so this should never reach a caller.
 */
public class LayoutInvariantViolation extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public LayoutInvariantViolation(String message) {
        super(message);
    }
}
