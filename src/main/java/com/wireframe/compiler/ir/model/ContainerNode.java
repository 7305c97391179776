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
public final class ContainerNode extends IrNode {
    @NonNull
    private final ContainerType containerType;
    @NonNull
    private final PropertyBag params;
    @NonNull
    private final List<NodeRef> children;

    @Builder
    private ContainerNode(String id, ContainerType containerType, PropertyBag params, List<NodeRef> children,
                          NodeStyle style, NodeMeta meta) {
        super(id, style, meta);
        this.containerType = containerType;
        this.params = params == null ? PropertyBag.empty() : params;
        this.children = children == null ? List.of() : List.copyOf(children);
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CONTAINER;
    }

    @Override
    public List<NodeRef> references() {
        return children;
    }

    public boolean isCell() {
        return getMeta().isCell();
    }
}
