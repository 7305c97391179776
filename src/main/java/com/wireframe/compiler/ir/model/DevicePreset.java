package com.wireframe.compiler.ir.model;

import java.util.Locale;

import lombok.Getter;

/**
 * Baseline viewports for the {@code device} style token. Height is a minimum; rendered output may grow.
 */
@Getter
public enum DevicePreset {
    MOBILE("mobile", 375, 812),
    TABLET("tablet", 768, 1024),
    DESKTOP("desktop", 1280, 720),
    PRINT("print", 794, 1123),
    A4("a4", 794, 1123);

    private final String token;
    private final int width;
    private final int minHeight;

    DevicePreset(String token, int width, int minHeight) {
        this.token = token;
        this.width = width;
        this.minHeight = minHeight;
    }

    public Viewport viewport() {
        return new Viewport(width, minHeight);
    }

    /**
     * Resolves a device token case-insensitively; unknown or absent tokens fall back to desktop.
     */
    public static DevicePreset resolve(String device) {
        if (device == null) {
            return DESKTOP;
        }
        String key = device.trim().toLowerCase(Locale.ROOT);
        for (DevicePreset preset : values()) {
            if (preset.token.equals(key)) {
                return preset;
            }
        }
        return DESKTOP;
    }
}
