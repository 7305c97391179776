package com.wireframe.compiler.syntax;

import lombok.Builder;
import lombok.Value;

/**
 * A {@code define} block. The body is a layout or a single component.
 */
@Value
@Builder
public class DefinitionSyntax {
    String name;
    DefinitionKind kind;
    SyntaxNode body;
    SourceSpan span;
    String nodeId;
}
