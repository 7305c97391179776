package com.wireframe.compiler.syntax;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * A {@code component <Name> key: value ...} invocation: a built-in leaf, a user definition,
 * or the {@code Children} placeholder of a layout definition.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class ComponentSyntax extends SyntaxNode {
    public static final String CHILDREN_SLOT = "Children";

    private String componentType;
    private Map<String, Object> props = new LinkedHashMap<>();

    @Builder
    public ComponentSyntax(String componentType, Map<String, Object> props, SourceSpan span, String nodeId) {
        this.componentType = componentType;
        this.props = props != null ? props : new LinkedHashMap<>();
        this.span = span;
        this.nodeId = nodeId;
    }

    @Override
    public void accept(SyntaxNodeVisitor visitor) {
        visitor.visit(this);
    }

    public boolean isChildrenSlot() {
        return CHILDREN_SLOT.equals(componentType);
    }
}
