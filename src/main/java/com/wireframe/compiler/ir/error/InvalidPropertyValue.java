package com.wireframe.compiler.ir.error;

import com.wireframe.compiler.syntax.SourceSpan;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A property value outside its declared domain, or a required property with no value.
 * {@code actual} is null when the value is missing.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
public final class InvalidPropertyValue extends IrError {
    private final String nodeId;
    private final String property;
    private final String expectedDomain;
    private final Object actual;

    public InvalidPropertyValue(String nodeId, String property, String expectedDomain, Object actual, SourceSpan location) {
        super(location);
        this.nodeId = nodeId;
        this.property = property;
        this.expectedDomain = expectedDomain;
        this.actual = actual;
    }

    public boolean isMissing() {
        return actual == null;
    }

    @Override
    public String code() {
        return "invalid-property";
    }

    @Override
    public String describe() {
        String owner = nodeId == null ? "" : " on " + nodeId;
        if (isMissing()) {
            return "Missing required property '" + property + "'" + owner + " (expected " + expectedDomain + ")";
        }
        return "Property '" + property + "'" + owner + " has value '" + actual + "', expected " + expectedDomain;
    }
}
