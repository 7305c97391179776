package com.wireframe.compiler.config;

import java.nio.file.Path;

import lombok.Builder;
import lombok.Data;

/**
 * Settings for one compiler run, built from validated command line options.
 */
@Data
@Builder
public class CompilerConfig {

    /**
     * Syntax tree JSON to compile.
     */
    private Path inputPath;

    /**
     * Directory receiving {@code ir.json} and the per-screen layout files.
     */
    private Path outputDir;

    /**
     * Screen id or name to lay out. Null lays out every screen.
     */
    private String screen;

    /**
     * Viewport width used instead of each screen's device width. Null keeps the device width.
     */
    private Double width;

    /**
     * Whether existing output files may be overwritten.
     */
    private boolean force;

    /**
     * Whether to stop after diagnostics without writing any file.
     */
    private boolean reportOnly;

    public boolean hasWidthOverride() {
        return width != null;
    }
}
