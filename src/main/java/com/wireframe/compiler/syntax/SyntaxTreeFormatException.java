package com.wireframe.compiler.syntax;

/**
 * Thrown when a syntax tree document is not valid JSON or does not have the expected shape.
 */
public class SyntaxTreeFormatException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SyntaxTreeFormatException(String message) {
        super(message);
    }

    public SyntaxTreeFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
