package com.pystructure.core.service;

import com.pystructure.core.model.ModuleStructure;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Outcome of analyzing one source file.
 *
 * <p>Three shapes occur:</p>
 * <ul>
 *   <li>success - {@code structure} set, {@code error} null</li>
 *   <li>analysis failure - {@code structure} holds the partial record, {@code error} set</li>
 *   <li>input or parse failure - {@code structure} null, {@code error} set</li>
 * </ul>
 *
 * @param filePath analyzed path, as given
 * @param structure analyzed structure (may be null)
 * @param error error message (may be null)
 */
public record FileAnalysis(
    Path filePath,
    ModuleStructure structure,
    String error
) {
    public FileAnalysis {
        Objects.requireNonNull(filePath, "filePath must not be null");
        if (structure == null && error == null) {
            throw new IllegalArgumentException("Either structure or error must be set");
        }
    }

    /**
     * Creates the outcome of a completed analysis; the structure's own analysis error,
     * if any, becomes the outcome's error.
     *
     * @param filePath analyzed path
     * @param structure analyzed structure
     * @return analysis outcome
     */
    public static FileAnalysis of(Path filePath, ModuleStructure structure) {
        return new FileAnalysis(filePath, structure, structure.getAnalysisError());
    }

    /**
     * Creates the outcome of a file that could not be read or parsed.
     *
     * @param filePath analyzed path
     * @param error error message
     * @return failed outcome
     */
    public static FileAnalysis failed(Path filePath, String error) {
        return new FileAnalysis(filePath, null, Objects.requireNonNull(error, "error must not be null"));
    }

    public boolean hasError() {
        return error != null;
    }
}
