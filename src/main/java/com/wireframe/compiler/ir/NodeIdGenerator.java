package com.wireframe.compiler.ir;

import com.wireframe.compiler.ir.model.NodeKind;

/**
 * Build-order counter behind every node id. One instance per build, so ids restart at 1.
 */
class NodeIdGenerator {
    private int counter;

    String next(NodeKind kind) {
        counter++;
        return kind.tag() + "_" + counter;
    }
}
