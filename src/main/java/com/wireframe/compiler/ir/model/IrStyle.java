package com.wireframe.compiler.ir.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Project-wide style tokens, kept unresolved.
 */
@Value
@Builder(toBuilder = true)
public class IrStyle {
    @NonNull
    @Builder.Default
    String density = "normal";

    @NonNull
    @Builder.Default
    String spacing = "md";

    @NonNull
    @Builder.Default
    String radius = "md";

    @NonNull
    @Builder.Default
    String stroke = "normal";

    @NonNull
    @Builder.Default
    String font = "base";

    String background;
    String theme;
    String device;
}
