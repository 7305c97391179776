package com.wireframe.compiler.ir;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.wireframe.compiler.ir.model.IrNode;
import com.wireframe.compiler.ir.model.NodeKind;
import com.wireframe.compiler.ir.schema.ComponentCatalog;

import lombok.Getter;

/**
 * Mutable state of one build. Never shared between builds.
 *
 * Ids are allocated before a node's children are expanded and the node itself is registered
 * afterwards, so {@link #nodeTable()} restores allocation order.
 */
class BuildSession {
    @Getter
    private final ComponentCatalog catalog;
    @Getter
    private final BuildDiagnostics diagnostics = new BuildDiagnostics();

    private final NodeIdGenerator ids = new NodeIdGenerator();
    private final List<String> allocationOrder = new ArrayList<>();
    private final Map<String, IrNode> registered = new HashMap<>();

    BuildSession(ComponentCatalog catalog) {
        this.catalog = catalog;
    }

    String allocate(NodeKind kind) {
        String id = ids.next(kind);
        allocationOrder.add(id);
        return id;
    }

    void register(IrNode node) {
        registered.put(node.getId(), node);
    }

    /**
     * Registered nodes in id allocation order. Ids whose node was abandoned after an error are skipped.
     */
    Map<String, IrNode> nodeTable() {
        Map<String, IrNode> table = new LinkedHashMap<>();
        for (String id : allocationOrder) {
            IrNode node = registered.get(id);
            if (node != null) {
                table.put(id, node);
            }
        }
        return table;
    }
}
