package com.wireframe.compiler.ir.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class IrScreen {
    @NonNull
    String id;
    @NonNull
    String name;
    @NonNull
    Viewport viewport;
    @NonNull
    NodeRef root;
    String background;
}
