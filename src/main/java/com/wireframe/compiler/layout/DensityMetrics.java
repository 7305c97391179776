package com.wireframe.compiler.layout;

import java.util.Locale;
import java.util.Map;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * Pixel metrics that depend on the project {@code density} token.
 */
@Getter
public enum DensityMetrics {
    COMPACT(0.8, 32, 12, 1.4, 16,
            Map.of("xs", 10, "sm", 12, "md", 16, "lg", 20, "xl", 28),
            Map.of("sm", 28, "md", 32, "lg", 36)),
    NORMAL(1.0, 40, 14, 1.5, 20,
            Map.of("xs", 12, "sm", 14, "md", 18, "lg", 24, "xl", 32),
            Map.of("sm", 36, "md", 40, "lg", 48)),
    COMFORTABLE(1.25, 48, 16, 1.6, 24,
            Map.of("xs", 14, "sm", 16, "md", 20, "lg", 28, "xl", 36),
            Map.of("sm", 40, "md", 48, "lg", 56));

    public static final double HEADING_LINE_HEIGHT = 1.25;

    /** Multiplier applied to spacing tokens. */
    private final double spacingFactor;
    /** Minimum height of a control, also reserved by empty containers. */
    private final int controlHeight;
    private final int textFontSize;
    private final double textLineHeight;
    private final int headingFontSize;

    @Getter(AccessLevel.NONE)
    private final Map<String, Integer> iconSizes;
    @Getter(AccessLevel.NONE)
    private final Map<String, Integer> iconButtonSizes;

    DensityMetrics(double spacingFactor, int controlHeight, int textFontSize, double textLineHeight,
                   int headingFontSize, Map<String, Integer> iconSizes, Map<String, Integer> iconButtonSizes) {
        this.spacingFactor = spacingFactor;
        this.controlHeight = controlHeight;
        this.textFontSize = textFontSize;
        this.textLineHeight = textLineHeight;
        this.headingFontSize = headingFontSize;
        this.iconSizes = iconSizes;
        this.iconButtonSizes = iconButtonSizes;
    }

    public int iconSize(String size) {
        return iconSizes.getOrDefault(size == null ? "md" : size, iconSizes.get("md"));
    }

    public int iconButtonSize(String size) {
        return iconButtonSizes.getOrDefault(size == null ? "md" : size, iconButtonSizes.get("md"));
    }

    /**
     * Metrics for a density token; unknown or absent tokens use {@link #NORMAL}.
     */
    public static DensityMetrics forDensity(String density) {
        if (density == null) {
            return NORMAL;
        }
        return switch (density.trim().toLowerCase(Locale.ROOT)) {
            case "compact" -> COMPACT;
            case "comfortable" -> COMFORTABLE;
            default -> NORMAL;
        };
    }
}
