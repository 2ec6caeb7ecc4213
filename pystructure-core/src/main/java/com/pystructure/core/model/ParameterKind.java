package com.pystructure.core.model;

/**
 * Parameter kinds, in the order they appear in a signature.
 */
public enum ParameterKind {
    /** Declared before {@code /}. */
    POSITIONAL_ONLY,
    /** Ordinary parameter. */
    POSITIONAL_OR_KEYWORD,
    /** {@code *args}. */
    VAR_POSITIONAL,
    /** Declared after {@code *} or {@code *args}. */
    KEYWORD_ONLY,
    /** {@code **kwargs}. */
    VAR_KEYWORD
}
