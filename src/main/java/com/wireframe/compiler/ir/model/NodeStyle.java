package com.wireframe.compiler.ir.model;

import lombok.Builder;
import lombok.Value;

/**
 * Style tokens carried by a node. Values stay unresolved: either a spacing/alignment token
 * or a number written as a string.
 */
@Value
@Builder(toBuilder = true)
public class NodeStyle {
    public static final NodeStyle EMPTY = NodeStyle.builder().build();

    String padding;
    String gap;
    String align;
    String justify;
    String background;
}
