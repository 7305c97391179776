package com.wireframe.compiler.ir.error;

import java.util.List;

import com.wireframe.compiler.syntax.SourceSpan;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A definition reaches itself through its own body. The chain starts and ends with the same name.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
public final class CyclicComponentDefinition extends IrError {
    private final List<String> chain;

    public CyclicComponentDefinition(List<String> chain, SourceSpan location) {
        super(location);
        this.chain = List.copyOf(chain);
    }

    @Override
    public String code() {
        return "cyclic-definition";
    }

    @Override
    public String describe() {
        return "Cyclic definition: " + String.join(" -> ", chain);
    }
}
