package com.wireframe.compiler.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File names and writes for compiler output.
 */
final class OutputFiles {
    static final String IR_FILE = "ir.json";

    private OutputFiles() {
    }

    static String layoutFileName(String screenId) {
        return "layout-" + screenId + ".json";
    }

    /**
     * Writes content to a file, creating parent directories if needed.
     */
    static void write(Path file, String content) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, content);
    }
}
