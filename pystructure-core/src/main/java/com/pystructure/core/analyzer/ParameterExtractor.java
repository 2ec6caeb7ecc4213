package com.pystructure.core.analyzer;

import com.pystructure.core.ast.PythonTree.Arg;
import com.pystructure.core.ast.PythonTree.Arguments;
import com.pystructure.core.ast.PythonTree.Expr;
import com.pystructure.core.model.ParameterInfo;
import com.pystructure.core.model.ParameterKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens a parameter list into {@link ParameterInfo} entries.
 *
 * <p>Order: positional-only, positional-or-keyword, {@code *args}, keyword-only,
 * {@code **kwargs}. Positional defaults align with the tail of the positional-only and
 * positional-or-keyword parameters taken together, so {@code def f(a, b=1, /, c=2)}
 * reports defaults for both {@code b} and {@code c}.
 */
final class ParameterExtractor {

    private ParameterExtractor() {
        // Utility class
    }

    static List<ParameterInfo> extract(Arguments arguments) {
        List<ParameterInfo> parameters = new ArrayList<>();

        List<Arg> positional = new ArrayList<>(arguments.positionalOnly());
        positional.addAll(arguments.args());
        List<Expr> defaults = arguments.defaults();
        int firstDefault = positional.size() - defaults.size();

        for (int i = 0; i < positional.size(); i++) {
            Arg arg = positional.get(i);
            ParameterKind kind = i < arguments.positionalOnly().size()
                ? ParameterKind.POSITIONAL_ONLY
                : ParameterKind.POSITIONAL_OR_KEYWORD;
            Expr defaultValue = i >= firstDefault ? defaults.get(i - firstDefault) : null;
            parameters.add(parameter(arg, defaultValue, kind));
        }

        if (arguments.varArg() != null) {
            parameters.add(parameter(arguments.varArg(), null, ParameterKind.VAR_POSITIONAL));
        }

        List<Arg> keywordOnly = arguments.keywordOnly();
        for (int i = 0; i < keywordOnly.size(); i++) {
            parameters.add(parameter(keywordOnly.get(i), arguments.keywordDefault(i), ParameterKind.KEYWORD_ONLY));
        }

        if (arguments.kwArg() != null) {
            parameters.add(parameter(arguments.kwArg(), null, ParameterKind.VAR_KEYWORD));
        }
        return parameters;
    }

    private static ParameterInfo parameter(Arg arg, Expr defaultValue, ParameterKind kind) {
        return new ParameterInfo(
            arg.name(),
            NodeRenderer.render(arg.annotation()),
            NodeRenderer.render(defaultValue),
            kind
        );
    }
}
