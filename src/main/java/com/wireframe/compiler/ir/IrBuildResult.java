package com.wireframe.compiler.ir;

import java.util.List;
import java.util.stream.Collectors;

import com.wireframe.compiler.ir.error.IrError;
import com.wireframe.compiler.ir.model.IrNodeGraph;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Outcome of {@link IrBuilder#build}. On failure {@code graph} is null and {@code errors} is non-empty.
 */
@Value
@Builder
public class IrBuildResult {
    boolean success;
    IrNodeGraph graph;

    @NonNull
    @Builder.Default
    List<IrError> errors = List.of();

    @NonNull
    @Builder.Default
    List<String> warnings = List.of();

    public static IrBuildResult success(IrNodeGraph graph, List<String> warnings) {
        return IrBuildResult.builder()
                .success(true)
                .graph(graph)
                .warnings(List.copyOf(warnings))
                .build();
    }

    public static IrBuildResult failure(List<IrError> errors, List<String> warnings) {
        return IrBuildResult.builder()
                .success(false)
                .errors(List.copyOf(errors))
                .warnings(List.copyOf(warnings))
                .build();
    }

    public <T extends IrError> List<T> errorsOfType(Class<T> type) {
        return errors.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }
}
