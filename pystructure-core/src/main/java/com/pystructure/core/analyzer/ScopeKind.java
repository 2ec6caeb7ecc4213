package com.pystructure.core.analyzer;

/**
 * Kind of a lexical scope on the {@link ScopeStack}.
 */
public enum ScopeKind {
    MODULE,
    CLASS,
    FUNCTION
}
