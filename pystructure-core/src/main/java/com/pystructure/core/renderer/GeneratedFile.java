package com.pystructure.core.renderer;

import java.util.Objects;

/**
 * One report document to be rendered.
 *
 * @param relativePath path relative to the output directory (e.g., "report.json")
 * @param content document text
 * @param contentType media type (e.g., "application/json")
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    public static final String JSON = "application/json";

    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }
}
