package com.wireframe.compiler.ir.model;

import java.util.List;
import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Root of the IR. {@code nodes} is the single node table, ordered by build counter.
 */
@Value
@Builder
public class IrProject {
    @NonNull
    String id;
    @NonNull
    String name;
    @NonNull
    IrStyle style;

    @NonNull
    @Builder.Default
    Map<String, String> colors = Map.of();

    @NonNull
    @Builder.Default
    Map<String, String> mocks = Map.of();

    @NonNull
    @Builder.Default
    List<IrScreen> screens = List.of();

    @NonNull
    @Builder.Default
    Map<String, IrNode> nodes = Map.of();
}
