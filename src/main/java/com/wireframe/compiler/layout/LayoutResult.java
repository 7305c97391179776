package com.wireframe.compiler.layout;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Boxes of every node reachable from one screen root, in placement order.
 */
@ToString
@EqualsAndHashCode
public final class LayoutResult {
    private static final LayoutResult EMPTY = new LayoutResult(Map.of());

    private final Map<String, LayoutBox> boxes;

    public LayoutResult(Map<String, LayoutBox> boxes) {
        this.boxes = Collections.unmodifiableMap(new LinkedHashMap<>(boxes));
    }

    public static LayoutResult empty() {
        return EMPTY;
    }

    public Optional<LayoutBox> box(String nodeId) {
        return Optional.ofNullable(boxes.get(nodeId));
    }

    public boolean contains(String nodeId) {
        return boxes.containsKey(nodeId);
    }

    public Map<String, LayoutBox> asMap() {
        return boxes;
    }

    public int size() {
        return boxes.size();
    }

    public boolean isEmpty() {
        return boxes.isEmpty();
    }
}
