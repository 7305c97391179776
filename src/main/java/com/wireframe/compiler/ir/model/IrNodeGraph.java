package com.wireframe.compiler.ir.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.Getter;

/**
 * Immutable result of a successful build. All maps and lists are defensive, unmodifiable copies
 * that keep their insertion order.
 */
public final class IrNodeGraph {
    public static final String IR_VERSION = "1.0";

    @Getter
    private final IrProject project;

    public IrNodeGraph(IrProject project) {
        this.project = freeze(project);
    }

    private static IrProject freeze(IrProject project) {
        return IrProject.builder()
                .id(project.getId())
                .name(project.getName())
                .style(project.getStyle())
                .colors(Collections.unmodifiableMap(new LinkedHashMap<>(project.getColors())))
                .mocks(Collections.unmodifiableMap(new LinkedHashMap<>(project.getMocks())))
                .screens(List.copyOf(project.getScreens()))
                .nodes(Collections.unmodifiableMap(new LinkedHashMap<>(project.getNodes())))
                .build();
    }

    public Optional<IrNode> node(String id) {
        return Optional.ofNullable(project.getNodes().get(id));
    }

    public Optional<IrNode> node(NodeRef ref) {
        return ref == null ? Optional.empty() : node(ref.getRef());
    }

    public Collection<IrNode> nodes() {
        return project.getNodes().values();
    }

    public Map<String, IrNode> nodeTable() {
        return project.getNodes();
    }

    public List<IrScreen> screens() {
        return project.getScreens();
    }

    public IrStyle style() {
        return project.getStyle();
    }

    /**
     * Finds a screen by id first, then by its declared name.
     */
    public Optional<IrScreen> findScreen(String idOrName) {
        if (idOrName == null) {
            return Optional.empty();
        }
        for (IrScreen screen : project.getScreens()) {
            if (screen.getId().equals(idOrName)) {
                return Optional.of(screen);
            }
        }
        for (IrScreen screen : project.getScreens()) {
            if (screen.getName().equals(idOrName)) {
                return Optional.of(screen);
            }
        }
        return Optional.empty();
    }

    public int size() {
        return project.getNodes().size();
    }
}
