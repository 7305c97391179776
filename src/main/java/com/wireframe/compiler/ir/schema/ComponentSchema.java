package com.wireframe.compiler.ir.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.Getter;
import lombok.ToString;

/**
 * Ordered property schemas of one component or container kind.
 */
@Getter
@ToString
public final class ComponentSchema {
    private final String name;
    private final boolean container;
    private final Map<String, PropertySchema> properties;

    public ComponentSchema(String name, boolean container, Map<String, PropertySchema> properties) {
        this.name = name;
        this.container = container;
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public Optional<PropertySchema> property(String propertyName) {
        return Optional.ofNullable(properties.get(propertyName));
    }

    /**
     * Defaults in declaration order, for properties that declare one.
     */
    public Map<String, Object> defaults() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        properties.values().stream()
                .filter(PropertySchema::hasDefault)
                .forEach(property -> defaults.put(property.getName(), property.getDefaultValue()));
        return defaults;
    }

    public boolean isRequiredWithoutDefault(String propertyName) {
        return property(propertyName).map(PropertySchema::isRequiredWithoutDefault).orElse(false);
    }
}
