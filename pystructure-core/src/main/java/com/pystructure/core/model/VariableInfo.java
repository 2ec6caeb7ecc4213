package com.pystructure.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A variable binding: constant, global, class, instance or local variable.
 *
 * @param name variable name; dotted for attribute targets (e.g., "config.debug")
 * @param type rendered annotation (may be null)
 * @param line line of the binding statement (may be null)
 */
public record VariableInfo(
    @JsonProperty("name") String name,
    @JsonProperty("type") String type,
    @JsonProperty("line") Integer line
) {
    public VariableInfo {
        Objects.requireNonNull(name, "name must not be null");
    }
}
