package com.pystructure.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of a function definition.
 *
 * <p>Anything defined outside a class body is a {@link #FUNCTION}; the other kinds only
 * apply to methods.
 */
public enum FunctionKind {
    FUNCTION("function"),
    INSTANCE_METHOD("instance_method"),
    CLASSMETHOD("classmethod"),
    STATICMETHOD("staticmethod"),
    PROPERTY("property");

    private final String id;

    FunctionKind(String id) {
        this.id = id;
    }

    /**
     * Returns the lowercase identifier used in reports.
     *
     * @return kind identifier (e.g., "instance_method")
     */
    @JsonValue
    public String id() {
        return id;
    }
}
