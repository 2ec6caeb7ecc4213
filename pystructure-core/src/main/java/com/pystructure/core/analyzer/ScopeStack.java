package com.pystructure.core.analyzer;

import com.pystructure.core.model.ModuleStructure;
import com.pystructure.core.model.ScopeRecord;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;

/**
 * Chain of scopes enclosing the node being analyzed.
 *
 * <p>The module scope sits at the bottom and cannot be popped. Pushing a scope assigns its
 * record's dotted full path: the parent path plus {@code "." + localName}, or the bare
 * name directly under the module.
 */
public final class ScopeStack {

    /**
     * One entry of the stack.
     *
     * @param kind scope kind
     * @param fullPath dotted path ("" for the module)
     * @param record accumulator record of the scope
     */
    public record Scope(ScopeKind kind, String fullPath, ScopeRecord record) {
        public Scope {
            Objects.requireNonNull(kind, "kind must not be null");
            Objects.requireNonNull(fullPath, "fullPath must not be null");
            Objects.requireNonNull(record, "record must not be null");
        }
    }

    private final Deque<Scope> scopes = new ArrayDeque<>();

    /**
     * Creates a stack whose root is the given module record.
     *
     * @param root module record
     */
    public ScopeStack(ModuleStructure root) {
        root.setFullPath("");
        scopes.push(new Scope(ScopeKind.MODULE, "", root));
    }

    /**
     * Enters a class or function scope.
     *
     * @param record record of the new scope
     * @param kind scope kind
     * @param localName name of the definition
     * @return the pushed scope
     */
    public Scope push(ScopeRecord record, ScopeKind kind, String localName) {
        if (kind == ScopeKind.MODULE) {
            throw new IllegalArgumentException("Module scope is only valid at the root");
        }
        String parentPath = current().fullPath();
        String fullPath = parentPath.isEmpty() ? localName : parentPath + "." + localName;
        record.setFullPath(fullPath);

        Scope scope = new Scope(kind, fullPath, record);
        scopes.push(scope);
        return scope;
    }

    /**
     * Leaves the current scope. Does nothing at the module scope.
     */
    public void pop() {
        if (scopes.size() > 1) {
            scopes.pop();
        }
    }

    public Scope current() {
        return scopes.peek();
    }

    /**
     * Finds the innermost class scope, which may be the current scope itself.
     *
     * @return nearest class scope, or empty when no class encloses the current position
     */
    public Optional<Scope> nearestEnclosingClass() {
        Iterator<Scope> it = scopes.iterator();
        while (it.hasNext()) {
            Scope scope = it.next();
            if (scope.kind() == ScopeKind.CLASS) {
                return Optional.of(scope);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the number of scopes on the stack, the module included.
     *
     * @return stack depth (at least 1)
     */
    public int depth() {
        return scopes.size();
    }
}
