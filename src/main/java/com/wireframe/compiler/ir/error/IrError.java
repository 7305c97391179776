package com.wireframe.compiler.ir.error;

import com.wireframe.compiler.syntax.SourceSpan;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Structured build error. Carries data only; turning it into text with line and column is left to callers.
 */
@Getter
@EqualsAndHashCode
public abstract class IrError {

    /** Source position copied from the syntax tree, or null when the error has no single location. */
    private final SourceSpan location;

    protected IrError(SourceSpan location) {
        this.location = location;
    }

    /**
     * Stable machine-readable identifier of the error kind.
     */
    public abstract String code();

    /**
     * One-line description without location information.
     */
    public abstract String describe();

    @Override
    public String toString() {
        return location == null
                ? "[" + code() + "] " + describe()
                : "[" + code() + "] " + describe() + " at " + location;
    }
}
