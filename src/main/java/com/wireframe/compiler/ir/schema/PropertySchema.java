package com.wireframe.compiler.ir.schema;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Declared domain, default and required flag of one component or container property.
 */
@Value
@Builder
public class PropertySchema {
    public static final List<String> SPACING_TOKENS = List.of("none", "xs", "sm", "md", "lg", "xl");

    @NonNull
    String name;

    @NonNull
    PropertyType type;

    @Singular
    List<String> allowedValues;

    boolean required;

    /** Value filled in when the property is absent; null when there is none. */
    Object defaultValue;

    public boolean hasDefault() {
        return defaultValue != null;
    }

    /**
     * A property is required for binding purposes only when no default can stand in for it.
     */
    public boolean isRequiredWithoutDefault() {
        return required && defaultValue == null;
    }

    public boolean accepts(Object value) {
        if (value == null) {
            return false;
        }
        return switch (type) {
            case STRING, COLOR -> true;
            case NUMBER -> isNumeric(value);
            case BOOLEAN -> value instanceof Boolean || "true".equals(value) || "false".equals(value);
            case ENUM -> value instanceof String text && allowedValues.contains(text);
            case SPACING -> (value instanceof String text && SPACING_TOKENS.contains(text))
                    || (isNumeric(value) && toDouble(value) >= 0);
        };
    }

    public String describeDomain() {
        return switch (type) {
            case STRING -> "string";
            case COLOR -> "color";
            case NUMBER -> "number";
            case BOOLEAN -> "boolean";
            case ENUM -> String.join("|", allowedValues);
            case SPACING -> String.join("|", SPACING_TOKENS) + " or a non-negative number";
        };
    }

    private static boolean isNumeric(Object value) {
        if (value instanceof Number number) {
            return Double.isFinite(number.doubleValue());
        }
        if (value instanceof String text) {
            try {
                return Double.isFinite(Double.parseDouble(text.trim()));
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return false;
    }

    private static double toDouble(Object value) {
        return value instanceof Number number ? number.doubleValue() : Double.parseDouble(((String) value).trim());
    }
}
