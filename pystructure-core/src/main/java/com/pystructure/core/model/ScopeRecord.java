package com.pystructure.core.model;

/**
 * A record that owns a lexical scope: the module, a class or a function.
 *
 * <p>Scope records are accumulators. The analyzer creates them when it enters a
 * definition, registers them in their parent, and fills them while the body is walked.
 */
public sealed interface ScopeRecord permits ModuleStructure, ClassInfo, FunctionInfo {

    /**
     * Returns the dotted path of this scope within the file ("" for the module).
     *
     * @return full path
     */
    String getFullPath();

    /**
     * Sets the dotted path; assigned once, when the scope is entered.
     *
     * @param fullPath full path
     */
    void setFullPath(String fullPath);

    /**
     * Returns whether a function, method or class named {@code name} is already registered
     * directly in this scope.
     *
     * @param name candidate name
     * @return true if a same-named definition exists
     */
    boolean hasDefinition(String name);
}
