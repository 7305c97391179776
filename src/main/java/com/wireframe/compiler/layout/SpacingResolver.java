package com.wireframe.compiler.layout;

import java.util.Map;

import com.wireframe.compiler.ir.model.NodeStyle;

/**
 * Turns spacing tokens into pixels for one density.
 *
 * Tokens are scaled by the density factor and rounded; a numeric token is taken as raw pixels.
 */
public class SpacingResolver {
    private static final Map<String, Integer> SPACING_VALUES = Map.of(
            "none", 0,
            "xs", 4,
            "sm", 8,
            "md", 16,
            "lg", 24,
            "xl", 32);

    private final DensityMetrics metrics;
    private final String projectSpacing;

    public SpacingResolver(DensityMetrics metrics, String projectSpacing) {
        this.metrics = metrics;
        this.projectSpacing = projectSpacing;
    }

    /**
     * Absent or unknown padding is 0.
     */
    public double padding(NodeStyle style) {
        return resolve(style.getPadding());
    }

    /**
     * Absent gap falls back to the project spacing token.
     */
    public double gap(NodeStyle style) {
        return resolve(style.getGap() != null ? style.getGap() : projectSpacing);
    }

    public double resolve(String token) {
        if (token == null || token.isBlank()) {
            return 0;
        }
        String trimmed = token.trim();
        Integer base = SPACING_VALUES.get(trimmed);
        if (base != null) {
            return Math.round(base * metrics.getSpacingFactor());
        }
        try {
            return Math.max(0, Double.parseDouble(trimmed));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
