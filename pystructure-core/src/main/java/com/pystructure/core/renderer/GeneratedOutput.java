package com.pystructure.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Documents handed to a renderer in one call.
 *
 * @param files documents in rendering order
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    /**
     * Wraps a single document.
     *
     * @param file document
     * @return output holding just that document
     */
    public static GeneratedOutput of(GeneratedFile file) {
        return new GeneratedOutput(List.of(file));
    }
}
