package com.wireframe.compiler.layout;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic word wrap used for intrinsic text heights.
 *
 * Character width is approximated as {@code fontSize * 0.6} instead of real font metrics so that
 * every run, and every renderer calling this class, breaks lines in the same places.
 */
public final class TextWrapper {

    public static final double CHAR_WIDTH_FACTOR = 0.6;

    private TextWrapper() {
        // Utility class
    }

    /**
     * Wraps {@code text} into lines no longer than {@code maxWidth} allows at {@code fontSize}.
     * Explicit newlines start new paragraphs and blank paragraphs yield empty lines. Words longer
     * than a line are cut into line-sized chunks. Never returns an empty list.
     */
    public static List<String> wrap(String text, double maxWidth, double fontSize) {
        String normalized = text == null ? "" : text.replace("\r\n", "\n");
        int maxChars = maxCharsPerLine(maxWidth, fontSize);
        List<String> lines = new ArrayList<>();

        for (String paragraph : normalized.split("\n", -1)) {
            if (paragraph.trim().isEmpty()) {
                lines.add("");
                continue;
            }

            StringBuilder current = new StringBuilder();
            for (String word : paragraph.trim().split("\\s+")) {
                int candidateLength = current.length() == 0 ? word.length() : current.length() + 1 + word.length();
                if (candidateLength <= maxChars) {
                    if (current.length() > 0) {
                        current.append(' ');
                    }
                    current.append(word);
                    continue;
                }

                if (current.length() > 0) {
                    lines.add(current.toString());
                    current.setLength(0);
                }

                if (word.length() <= maxChars) {
                    current.append(word);
                    continue;
                }

                for (int i = 0; i < word.length(); i += maxChars) {
                    lines.add(word.substring(i, Math.min(word.length(), i + maxChars)));
                }
            }

            if (current.length() > 0) {
                lines.add(current.toString());
            }
        }

        return lines.isEmpty() ? List.of("") : List.copyOf(lines);
    }

    static int maxCharsPerLine(double maxWidth, double fontSize) {
        double charWidth = fontSize * CHAR_WIDTH_FACTOR;
        if (charWidth <= 0) {
            return 1;
        }
        double safeWidth = Math.max(maxWidth, charWidth);
        return Math.max(1, (int) Math.floor(safeWidth / charWidth));
    }
}
