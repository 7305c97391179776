package com.wireframe.compiler.ir;

import java.util.ArrayList;
import java.util.List;

import com.wireframe.compiler.ir.error.IrError;

import lombok.Getter;

/**
 * Errors and warnings accumulated during one build.
 *
 * Pure structure only: no logging, no formatting.
 */
@Getter
public class BuildDiagnostics {
    private final List<IrError> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public void error(IrError error) {
        errors.add(error);
    }

    public void warn(String warning) {
        warnings.add(warning);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
