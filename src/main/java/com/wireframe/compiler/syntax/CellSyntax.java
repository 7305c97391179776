package com.wireframe.compiler.syntax;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * A grid {@code cell span: n { ... }} wrapper.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class CellSyntax extends SyntaxNode {
    private Map<String, Object> props = new LinkedHashMap<>();
    private List<SyntaxNode> children = new ArrayList<>();

    @Builder
    public CellSyntax(Map<String, Object> props, List<SyntaxNode> children, SourceSpan span, String nodeId) {
        this.props = props != null ? props : new LinkedHashMap<>();
        this.children = children != null ? children : new ArrayList<>();
        this.span = span;
        this.nodeId = nodeId;
    }

    @Override
    public void accept(SyntaxNodeVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public List<SyntaxNode> getChildNodes() {
        return children;
    }
}
