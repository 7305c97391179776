package com.wireframe.compiler.ir.error;

import com.wireframe.compiler.syntax.SourceSpan;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Breach of a structural rule. {@code rule} is a short stable name such as {@code split-arity}.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
public final class StructuralViolation extends IrError {
    public static final String DUPLICATE_DEFINITION = "duplicate-definition";
    public static final String SCREEN_ROOT_COUNT = "screen-root-count";
    public static final String DUPLICATE_SCREEN_NAME = "duplicate-screen-name";
    public static final String SPLIT_ARITY = "split-arity";
    public static final String LAYOUT_CHILDREN_ARITY = "layout-children-arity";
    public static final String CHILDREN_SLOT_OUTSIDE_LAYOUT = "children-slot-outside-layout";
    public static final String DANGLING_REF = "dangling-ref";

    private final String rule;
    private final String nodeId;
    private final String detail;

    public StructuralViolation(String rule, String nodeId, String detail, SourceSpan location) {
        super(location);
        this.rule = rule;
        this.nodeId = nodeId;
        this.detail = detail;
    }

    @Override
    public String code() {
        return rule;
    }

    @Override
    public String describe() {
        return detail;
    }
}
