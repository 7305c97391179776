package com.wireframe.compiler.ir.model;

import java.util.List;

import com.wireframe.compiler.syntax.DefinitionKind;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * One invocation of a user definition. {@code expandedRoot} points at this call site's private
 * copy of the definition body.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public final class InstanceNode extends IrNode {
    @NonNull
    private final String definitionName;
    @NonNull
    private final DefinitionKind definitionKind;
    @NonNull
    private final PropertyBag props;
    @NonNull
    private final NodeRef expandedRoot;

    @Builder
    private InstanceNode(String id, String definitionName, DefinitionKind definitionKind, PropertyBag props,
                         NodeRef expandedRoot, NodeStyle style, NodeMeta meta) {
        super(id, style, meta);
        this.definitionName = definitionName;
        this.definitionKind = definitionKind;
        this.props = props == null ? PropertyBag.empty() : props;
        this.expandedRoot = expandedRoot;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.INSTANCE;
    }

    @Override
    public List<NodeRef> references() {
        return List.of(expandedRoot);
    }
}
