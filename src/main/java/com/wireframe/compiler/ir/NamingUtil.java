package com.wireframe.compiler.ir;

import java.util.Locale;

/**
 * Naming helpers shared by the builder.
 */
public class NamingUtil {

    private NamingUtil() {
        // Utility class
    }

    /**
     * Lower-cases a display name, turns whitespace runs into {@code _} and drops every
     * character outside {@code [a-z0-9_]}.
     */
    public static String sanitizeId(String name) {
        if (name == null) {
            return "";
        }
        return name.toLowerCase(Locale.ROOT)
                .replaceAll("\\s+", "_")
                .replaceAll("[^a-z0-9_]", "");
    }
}
