package com.pystructure.core.analyzer;

import com.pystructure.core.ast.PythonTree.Arguments;
import com.pystructure.core.model.FunctionKind;

import java.util.List;

/**
 * Decides the {@link FunctionKind} of a function defined directly in a class body.
 *
 * <p>Decorators are checked first, by substring of their rendered text: a property
 * pattern ({@code property}, {@code .setter}, {@code .deleter}), then {@code classmethod},
 * then {@code staticmethod}. Without a deciding decorator the first positional-or-keyword
 * parameter decides: {@code self} gives an instance method, {@code cls} a classmethod,
 * anything else or no parameter at all a staticmethod.
 */
public final class FunctionKindResolver {

    private FunctionKindResolver() {
        // Utility class
    }

    /**
     * Resolves the kind of a method.
     *
     * @param decorators rendered decorators
     * @param arguments parameter list of the method
     * @return method kind, never {@link FunctionKind#FUNCTION}
     */
    public static FunctionKind resolveMethodKind(List<String> decorators, Arguments arguments) {
        if (anyContains(decorators, "property", ".setter", ".deleter")) {
            return FunctionKind.PROPERTY;
        }
        if (anyContains(decorators, "classmethod")) {
            return FunctionKind.CLASSMETHOD;
        }
        if (anyContains(decorators, "staticmethod")) {
            return FunctionKind.STATICMETHOD;
        }

        if (arguments.args().isEmpty()) {
            return FunctionKind.STATICMETHOD;
        }
        String first = arguments.args().get(0).name();
        if ("cls".equals(first)) {
            return FunctionKind.CLASSMETHOD;
        }
        if (!"self".equals(first)) {
            return FunctionKind.STATICMETHOD;
        }
        return FunctionKind.INSTANCE_METHOD;
    }

    /**
     * Resolves the kind of any function definition.
     *
     * @param parent kind of the scope the definition appears in
     * @param decorators rendered decorators
     * @param arguments parameter list
     * @return {@link FunctionKind#FUNCTION} outside class bodies, the method kind inside
     */
    public static FunctionKind resolve(ScopeKind parent, List<String> decorators, Arguments arguments) {
        if (parent != ScopeKind.CLASS) {
            return FunctionKind.FUNCTION;
        }
        return resolveMethodKind(decorators, arguments);
    }

    private static boolean anyContains(List<String> decorators, String... patterns) {
        for (String decorator : decorators) {
            if (decorator == null) {
                continue;
            }
            for (String pattern : patterns) {
                if (decorator.contains(pattern)) {
                    return true;
                }
            }
        }
        return false;
    }
}
