package com.pystructure.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One parameter of a function signature.
 *
 * @param name parameter name
 * @param type rendered annotation (may be null)
 * @param defaultValue rendered default value (may be null)
 * @param kind parameter kind
 */
public record ParameterInfo(
    @JsonProperty("name") String name,
    @JsonProperty("type") String type,
    @JsonProperty("default") String defaultValue,
    @JsonProperty("kind") ParameterKind kind
) {
    public ParameterInfo {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }
}
