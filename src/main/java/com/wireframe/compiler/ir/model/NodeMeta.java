package com.wireframe.compiler.ir.model;

import com.wireframe.compiler.syntax.SourceSpan;

import lombok.Builder;
import lombok.Value;

/**
 * Provenance of an IR node.
 */
@Value
@Builder
public class NodeMeta {
    public static final String ORIGIN_CELL = "cell";

    /** Span of the syntax node this node was materialized from. */
    SourceSpan source;

    /** SourceMap identity of the syntax node, copied unchanged. */
    String sourceNodeId;

    /** {@code "cell"} for grid cell wrappers, otherwise null. */
    String origin;

    public boolean isCell() {
        return ORIGIN_CELL.equals(origin);
    }
}
