package com.wireframe.compiler.ir.model;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * Base of the closed IR node set. Every outgoing edge is a {@link NodeRef} into the node table.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class IrNode {
    @NonNull
    private final String id;
    @NonNull
    private final NodeStyle style;
    @NonNull
    private final NodeMeta meta;

    protected IrNode(String id, NodeStyle style, NodeMeta meta) {
        this.id = id;
        this.style = style == null ? NodeStyle.EMPTY : style;
        this.meta = meta == null ? NodeMeta.builder().build() : meta;
    }

    public abstract NodeKind getKind();

    /**
     * Outgoing references in traversal order.
     */
    public abstract List<NodeRef> references();
}
