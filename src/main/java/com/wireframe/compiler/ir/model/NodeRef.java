package com.wireframe.compiler.ir.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Non-owning reference to an entry of the node table.
 */
@Value
public class NodeRef {
    @NonNull
    String ref;

    public static NodeRef of(String ref) {
        return new NodeRef(ref);
    }

    @Override
    public String toString() {
        return ref;
    }
}
