package com.pystructure.core.analyzer;

import com.pystructure.core.ast.PythonTree.Attribute;
import com.pystructure.core.ast.PythonTree.BinOp;
import com.pystructure.core.ast.PythonTree.Call;
import com.pystructure.core.ast.PythonTree.Constant;
import com.pystructure.core.ast.PythonTree.DictExpr;
import com.pystructure.core.ast.PythonTree.Expr;
import com.pystructure.core.ast.PythonTree.Index;
import com.pystructure.core.ast.PythonTree.ListExpr;
import com.pystructure.core.ast.PythonTree.Name;
import com.pystructure.core.ast.PythonTree.SetExpr;
import com.pystructure.core.ast.PythonTree.Slice;
import com.pystructure.core.ast.PythonTree.Subscript;
import com.pystructure.core.ast.PythonTree.TupleExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders expressions (annotations, default values, decorators, base classes) as short,
 * source-like strings.
 *
 * <p>Rendering is bounded: recursion stops after {@link #DEFAULT_MAX_DEPTH} levels and
 * long literals and argument lists are truncated with {@code ...}. An absent node renders
 * as {@code null}; an empty result counts as absent wherever a composite node checks its
 * parts.
 *
 * <p><b>Examples:</b></p>
 * <ul>
 *   <li>{@code Optional[Dict[str, int]]} renders as {@code Optional[Dict[(..., ...)]]}</li>
 *   <li>{@code str | None} renders as {@code Optional[str]}</li>
 *   <li>{@code field(default_factory=list)} renders as {@code field(, ...)}</li>
 * </ul>
 *
 * <p>Never throws: an unexpected failure degrades to the node kind name.
 */
public final class NodeRenderer {

    private static final Logger log = LoggerFactory.getLogger(NodeRenderer.class);

    /** Default recursion budget. */
    public static final int DEFAULT_MAX_DEPTH = 3;

    private static final String ELLIPSIS = "...";
    private static final String MISSING = "?";
    private static final int MAX_LITERAL_LENGTH = 30;
    private static final int MAX_ARGUMENTS_LENGTH = 20;
    private static final int MAX_DICT_ENTRIES = 3;

    private NodeRenderer() {
        // Utility class
    }

    /**
     * Renders a node with the default depth budget.
     *
     * @param node expression to render (may be null)
     * @return rendered text, or null for an absent node
     */
    public static String render(Expr node) {
        return render(node, DEFAULT_MAX_DEPTH);
    }

    /**
     * Renders a node with an explicit depth budget.
     *
     * @param node expression to render (may be null)
     * @param maxDepth remaining recursion budget
     * @return rendered text, {@code "..."} when the budget is exhausted, or null for an absent node
     */
    public static String render(Expr node, int maxDepth) {
        if (node == null) {
            return null;
        }
        if (maxDepth <= 0) {
            return ELLIPSIS;
        }
        try {
            return renderNode(node, maxDepth);
        } catch (RuntimeException e) {
            log.debug("Failed to render {} node: {}", node.kind(), e.getMessage());
            return node.kind();
        }
    }

    private static String renderNode(Expr node, int maxDepth) {
        int next = maxDepth - 1;

        if (node instanceof Constant constant) {
            String literal = constant.literal();
            if (constant.value() instanceof String && codePoints(literal) > MAX_LITERAL_LENGTH) {
                return truncate(literal, MAX_LITERAL_LENGTH - ELLIPSIS.length());
            }
            return literal;
        }
        if (node instanceof Name name) {
            return name.id();
        }
        if (node instanceof Attribute attribute) {
            String base = render(attribute.value(), next);
            return present(base) ? base + "." + attribute.attr() : attribute.attr();
        }
        if (node instanceof Subscript subscript) {
            String base = render(subscript.value(), next);
            String slice = render(subscript.slice(), next);
            return present(base) && present(slice) ? base + "[" + slice + "]" : ELLIPSIS;
        }
        if (node instanceof Index index) {
            return render(index.value(), next);
        }
        if (node instanceof Slice slice) {
            return renderSlice(slice, next);
        }
        if (node instanceof ListExpr list) {
            return "[" + renderElements(list.elements(), next) + "]";
        }
        if (node instanceof TupleExpr tuple) {
            return "(" + renderElements(tuple.elements(), next) + ")";
        }
        if (node instanceof SetExpr set) {
            return "{" + renderElements(set.elements(), next) + "}";
        }
        if (node instanceof DictExpr dict) {
            return renderDict(dict, next);
        }
        if (node instanceof Call call) {
            return renderCall(call, next);
        }
        if (node instanceof BinOp binOp && BinOp.BIT_OR.equals(binOp.operator())) {
            return renderUnion(binOp, next);
        }
        return node.kind();
    }

    private static String renderSlice(Slice slice, int depth) {
        String lower = orEmpty(render(slice.lower(), depth));
        String upper = orEmpty(render(slice.upper(), depth));
        String step = orEmpty(render(slice.step(), depth));
        if (!step.isEmpty()) {
            return lower + ":" + upper + ":" + step;
        }
        return lower + ":" + upper;
    }

    private static String renderElements(List<Expr> elements, int depth) {
        List<String> rendered = new ArrayList<>(elements.size());
        for (Expr element : elements) {
            rendered.add(orMissing(render(element, depth)));
        }
        String content = String.join(", ", rendered);
        if (codePoints(content) > MAX_LITERAL_LENGTH) {
            content = truncate(content, MAX_LITERAL_LENGTH - ELLIPSIS.length());
        }
        return content;
    }

    private static String renderDict(DictExpr dict, int depth) {
        List<Expr> keys = dict.keys();
        List<Expr> values = dict.values();
        int entries = Math.min(keys.size(), values.size());

        List<String> items = new ArrayList<>();
        for (int i = 0; i < entries; i++) {
            String key = orMissing(render(keys.get(i), depth));
            String value = orMissing(render(values.get(i), depth));
            items.add(key + ": " + value);
            if (items.size() >= MAX_DICT_ENTRIES && keys.size() > MAX_DICT_ENTRIES) {
                items.add(ELLIPSIS);
                break;
            }
        }
        return "{" + String.join(", ", items) + "}";
    }

    private static String renderCall(Call call, int depth) {
        String callee = orMissing(render(call.func(), depth));

        List<String> rendered = new ArrayList<>(call.args().size());
        for (Expr arg : call.args()) {
            rendered.add(orMissing(render(arg, depth)));
        }
        String arguments = String.join(", ", rendered);
        if (codePoints(arguments) > MAX_ARGUMENTS_LENGTH) {
            arguments = truncate(arguments, MAX_ARGUMENTS_LENGTH - ELLIPSIS.length());
        }

        String closing = call.keywords().isEmpty() ? ")" : ", ...)";
        return callee + "(" + arguments + closing;
    }

    private static String renderUnion(BinOp binOp, int depth) {
        String left = render(binOp.left(), depth);
        String right = render(binOp.right(), depth);
        if (!present(left) || !present(right)) {
            return binOp.kind();
        }
        if ("None".equals(left) || "None".equals(right)) {
            return "Optional[" + ("None".equals(right) ? left : right) + "]";
        }
        return "Union[" + left + ", " + right + "]";
    }

    // Cuts to the first `keep` code points and appends "...".
    private static String truncate(String text, int keep) {
        int end = text.offsetByCodePoints(0, keep);
        return text.substring(0, end) + ELLIPSIS;
    }

    private static int codePoints(String text) {
        return text.codePointCount(0, text.length());
    }

    private static boolean present(String rendered) {
        return rendered != null && !rendered.isEmpty();
    }

    private static String orEmpty(String rendered) {
        return present(rendered) ? rendered : "";
    }

    private static String orMissing(String rendered) {
        return present(rendered) ? rendered : MISSING;
    }
}
