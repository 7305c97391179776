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
 * A {@code layout <type>(params) { ... }} block. The type is either a built-in container
 * kind or the name of a {@code define Layout}.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class LayoutSyntax extends SyntaxNode {
    private String layoutType;
    private Map<String, Object> params = new LinkedHashMap<>();
    private List<SyntaxNode> children = new ArrayList<>();

    @Builder
    public LayoutSyntax(String layoutType, Map<String, Object> params, List<SyntaxNode> children,
                        SourceSpan span, String nodeId) {
        this.layoutType = layoutType;
        this.params = params != null ? params : new LinkedHashMap<>();
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
