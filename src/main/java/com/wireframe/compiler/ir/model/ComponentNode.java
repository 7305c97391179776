package com.wireframe.compiler.ir.model;

import java.util.List;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class ComponentNode extends IrNode {
    @NonNull
    private final String componentType;
    @NonNull
    private final PropertyBag props;

    @Builder
    private ComponentNode(String id, String componentType, PropertyBag props, NodeStyle style, NodeMeta meta) {
        super(id, style, meta);
        this.componentType = componentType;
        this.props = props == null ? PropertyBag.empty() : props;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.COMPONENT;
    }

    @Override
    public List<NodeRef> references() {
        return List.of();
    }
}
