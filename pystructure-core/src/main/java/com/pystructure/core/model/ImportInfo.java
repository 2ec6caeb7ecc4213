package com.pystructure.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One imported name.
 *
 * <p>Example: {@code import numpy as np} yields {@code ImportInfo("numpy", "np", 1)}.
 *
 * @param name imported name
 * @param alias {@code as} alias (may be null)
 * @param line line of the import statement (may be null)
 */
public record ImportInfo(
    @JsonProperty("name") String name,
    @JsonProperty("alias") String alias,
    @JsonProperty("line") Integer line
) {
    public ImportInfo {
        Objects.requireNonNull(name, "name must not be null");
    }
}
