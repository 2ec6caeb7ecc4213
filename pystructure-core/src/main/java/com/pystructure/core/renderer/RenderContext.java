package com.pystructure.core.renderer;

import java.util.Map;
import java.util.Objects;

/**
 * Context provided to renderers during execution.
 *
 * @param outputDirectory target directory for file-based renderers
 * @param settings renderer-specific settings
 */
public record RenderContext(
    String outputDirectory,
    Map<String, String> settings
) {
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        settings = settings != null ? Map.copyOf(settings) : Map.of();
    }

    /**
     * Creates a context for renderers that ignore the output directory.
     *
     * @param settings renderer-specific settings
     * @return context rooted at the working directory
     */
    public static RenderContext of(Map<String, String> settings) {
        return new RenderContext(".", settings);
    }

    public String getSetting(String key) {
        return settings.get(key);
    }

    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }
}
