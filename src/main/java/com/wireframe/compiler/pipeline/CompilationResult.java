package com.wireframe.compiler.pipeline;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.wireframe.compiler.ir.IrBuildResult;
import com.wireframe.compiler.layout.LayoutResult;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a {@link CompilationPipeline} run.
 *
 * A run fails either before the build (unreadable input, {@code errorMessage} set and
 * {@code buildResult} null), during the build ({@code buildResult} unsuccessful) or after it
 * (unknown screen, refused overwrite, I/O problem; {@code errorMessage} set).
 */
@Value
@Builder
public class CompilationResult {
    boolean success;
    String errorMessage;
    IrBuildResult buildResult;

    /** Screen id to layout, in screen order. */
    @Builder.Default
    Map<String, LayoutResult> layouts = Map.of();

    @Builder.Default
    List<Path> writtenFiles = List.of();

    public boolean hasBuildResult() {
        return buildResult != null;
    }

    static CompilationResult failure(String message) {
        return CompilationResult.builder()
                .success(false)
                .errorMessage(message)
                .build();
    }

    static CompilationResult failure(String message, IrBuildResult buildResult) {
        return CompilationResult.builder()
                .success(false)
                .errorMessage(message)
                .buildResult(buildResult)
                .build();
    }
}
