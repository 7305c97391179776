package com.wireframe.compiler.ir.error;

import com.wireframe.compiler.syntax.SourceSpan;

import lombok.EqualsAndHashCode;
import lombok.Getter;

@Getter
@EqualsAndHashCode(callSuper = true)
public final class UndefinedComponent extends IrError {
    private final String name;

    public UndefinedComponent(String name, SourceSpan location) {
        super(location);
        this.name = name;
    }

    @Override
    public String code() {
        return "undefined-component";
    }

    @Override
    public String describe() {
        return "'" + name + "' is neither a built-in kind nor a defined component or layout";
    }
}
