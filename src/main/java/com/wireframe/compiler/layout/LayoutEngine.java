package com.wireframe.compiler.layout;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.wireframe.compiler.ir.model.IrNodeGraph;
import com.wireframe.compiler.ir.model.IrScreen;

/**
 * Computes a {@link LayoutBox} for every node reachable from a screen root.
 *
 * The engine trusts a validated graph and never re-validates it. Inconsistent nodes are skipped
 * instead of failing the whole layout. Each call runs its own {@link LayoutPass}, so an engine
 * instance can be shared between threads.
 */
public class LayoutEngine {
    private static final Logger log = LoggerFactory.getLogger(LayoutEngine.class);

    /** Metrics forced for every graph, or null to follow each project's density token. */
    private final DensityMetrics fixedMetrics;

    public LayoutEngine() {
        this(null);
    }

    public LayoutEngine(DensityMetrics fixedMetrics) {
        this.fixedMetrics = fixedMetrics;
    }

    /**
     * Lays out a screen at the width of its device viewport.
     */
    public LayoutResult layout(IrNodeGraph graph, String screenId) {
        Optional<IrScreen> screen = graph.findScreen(screenId);
        if (screen.isEmpty()) {
            log.warn("Unknown screen '{}'; nothing to lay out", screenId);
            return LayoutResult.empty();
        }
        return layout(graph, screen.get(), screen.get().getViewport().getWidth());
    }

    /**
     * Lays out a screen, selected by id or name, at {@code viewportWidth}.
     */
    public LayoutResult layout(IrNodeGraph graph, String screenId, double viewportWidth) {
        Optional<IrScreen> screen = graph.findScreen(screenId);
        if (screen.isEmpty()) {
            log.warn("Unknown screen '{}'; nothing to lay out", screenId);
            return LayoutResult.empty();
        }
        return layout(graph, screen.get(), viewportWidth);
    }

    private LayoutResult layout(IrNodeGraph graph, IrScreen screen, double viewportWidth) {
        DensityMetrics metrics = fixedMetrics != null
                ? fixedMetrics
                : DensityMetrics.forDensity(graph.style().getDensity());

        LayoutPass pass = new LayoutPass(graph, metrics, graph.style().getSpacing());
        LayoutResult result = pass.run(screen.getRoot(), viewportWidth);

        log.info("Layout of screen '{}' at width {} finished with {} box(es)",
                screen.getId(), viewportWidth, result.size());
        return result;
    }
}
