package com.wireframe.compiler.syntax;

import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Base class for the layout, component and cell nodes handed over by the parser.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public abstract class SyntaxNode {
    protected SourceSpan span;
    /** SourceMap identity assigned by the parser; copied into the IR unchanged. */
    protected String nodeId;

    public abstract void accept(SyntaxNodeVisitor visitor);

    public List<SyntaxNode> getChildNodes() {
        return List.of();
    }
}
