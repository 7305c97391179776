package com.wireframe.compiler.syntax;

import lombok.Value;

/**
 * Position of a syntax node in the wireframe source, as reported by the parser.
 */
@Value
public class SourceSpan {
    int line;
    int column;
    int offset;

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
