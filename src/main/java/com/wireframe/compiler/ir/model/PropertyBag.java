package com.wireframe.compiler.ir.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import lombok.EqualsAndHashCode;

/**
 * Immutable, insertion-ordered property map. Values are String, Integer, Double or Boolean.
 *
 * Accessors are lenient: a numeric accessor parses a numeric string, and every accessor returns
 * null when the key is absent or the value cannot be read as the requested type.
 */
@EqualsAndHashCode
public final class PropertyBag {
    private static final PropertyBag EMPTY = new PropertyBag(Map.of());

    private final Map<String, Object> values;

    private PropertyBag(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static PropertyBag empty() {
        return EMPTY;
    }

    public static PropertyBag of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        values.forEach((key, value) -> {
            if (value != null) {
                copy.put(key, normalize(key, value));
            }
        });
        return new PropertyBag(copy);
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public Object get(String key) {
        return values.get(key);
    }

    public String getString(String key) {
        Object value = values.get(key);
        return value == null ? null : String.valueOf(value);
    }

    public Double getDouble(String key) {
        Object value = values.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public Integer getInt(String key) {
        Double value = getDouble(key);
        if (value == null || value != Math.rint(value)) {
            return null;
        }
        return value.intValue();
    }

    public Boolean getBoolean(String key) {
        Object value = values.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if ("true".equals(value)) {
            return Boolean.TRUE;
        }
        if ("false".equals(value)) {
            return Boolean.FALSE;
        }
        return null;
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    private static Object normalize(String key, Object value) {
        if (value instanceof String || value instanceof Integer || value instanceof Double || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number number) {
            double asDouble = number.doubleValue();
            if (asDouble == Math.rint(asDouble) && Math.abs(asDouble) <= Integer.MAX_VALUE) {
                return Integer.valueOf((int) asDouble);
            }
            return Double.valueOf(asDouble);
        }
        throw new IllegalArgumentException("Unsupported value type for property '" + key + "': " + value.getClass().getName());
    }
}
