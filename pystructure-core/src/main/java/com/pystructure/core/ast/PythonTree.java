package com.pystructure.core.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Node types for a parsed Python module.
 *
 * <p>The node set is a closed tagged union over the statement and expression shapes the
 * structure analyzer and the node renderer consume. Every other node kind produced by the
 * parser is carried as an {@link Opaque} node: its kind name is kept and its children stay
 * reachable, so a generic traversal still visits definitions nested inside loops,
 * {@code try} blocks, {@code with} blocks and the like.
 *
 * <p>Nodes are immutable. Line numbers are best-effort and may be {@code null}.
 *
 * <p><b>Shape overview:</b></p>
 * <ul>
 *   <li>{@link Module} - root of a parsed file</li>
 *   <li>{@link Stmt} - {@link FunctionDef}, {@link ClassDef}, {@link Import}, {@link ImportFrom},
 *       {@link Assign}, {@link AnnAssign}, {@link If}, {@link ExprStmt}</li>
 *   <li>{@link Expr} - {@link Constant}, {@link Name}, {@link Attribute}, {@link Subscript},
 *       {@link Index}, {@link Slice}, {@link ListExpr}, {@link TupleExpr}, {@link SetExpr},
 *       {@link DictExpr}, {@link Call}, {@link BinOp}, {@link Compare}</li>
 *   <li>{@link Opaque} - fallback for both statements and expressions</li>
 * </ul>
 *
 * @see PythonTreeParser
 * @since 1.0.0
 */
public final class PythonTree {

    private PythonTree() {
        // Holder class - no instantiation
    }

    /**
     * Any node of the tree.
     */
    public sealed interface Node permits Module, Stmt, Expr, Keyword {

        /**
         * Returns the parser's class name for this node (e.g., "FunctionDef", "Call").
         *
         * @return node kind name
         */
        String kind();

        /**
         * Returns the direct child nodes in source field order.
         *
         * @return child nodes, never null
         */
        List<Node> children();
    }

    /**
     * A statement.
     */
    public sealed interface Stmt extends Node
        permits FunctionDef, ClassDef, Import, ImportFrom, Assign, AnnAssign, If, ExprStmt, Opaque {

        /**
         * Returns the 1-based source line of the statement.
         *
         * @return line number, or null when unknown
         */
        Integer line();
    }

    /**
     * An expression.
     */
    public sealed interface Expr extends Node
        permits Constant, Name, Attribute, Subscript, Index, Slice, ListExpr, TupleExpr, SetExpr,
                DictExpr, Call, BinOp, Compare, Opaque {
    }

    /**
     * Root of a parsed source file.
     *
     * @param body top-level statements
     */
    public record Module(List<Stmt> body) implements Node {
        public Module {
            body = body != null ? List.copyOf(body) : List.of();
        }

        @Override
        public String kind() {
            return "Module";
        }

        @Override
        public List<Node> children() {
            return List.copyOf(body);
        }
    }

    // --- Statements ---

    /**
     * A {@code def} or {@code async def} statement.
     *
     * @param name function name
     * @param arguments parameter list
     * @param body body statements
     * @param decorators decorator expressions, outermost first
     * @param returns return annotation (may be null)
     * @param async whether the function is declared {@code async}
     * @param line definition line
     */
    public record FunctionDef(
        String name,
        Arguments arguments,
        List<Stmt> body,
        List<Expr> decorators,
        Expr returns,
        boolean async,
        Integer line
    ) implements Stmt {
        public FunctionDef {
            Objects.requireNonNull(name, "name must not be null");
            arguments = arguments != null ? arguments : Arguments.empty();
            body = body != null ? List.copyOf(body) : List.of();
            decorators = decorators != null ? List.copyOf(decorators) : List.of();
        }

        @Override
        public String kind() {
            return async ? "AsyncFunctionDef" : "FunctionDef";
        }

        @Override
        public List<Node> children() {
            List<Node> children = new ArrayList<>(arguments.expressions());
            children.addAll(body);
            children.addAll(decorators);
            if (returns != null) {
                children.add(returns);
            }
            return children;
        }
    }

    /**
     * A {@code class} statement.
     *
     * @param name class name
     * @param bases base class expressions
     * @param keywords class keywords (e.g., {@code metaclass=ABCMeta})
     * @param body body statements
     * @param decorators decorator expressions
     * @param line definition line
     */
    public record ClassDef(
        String name,
        List<Expr> bases,
        List<Keyword> keywords,
        List<Stmt> body,
        List<Expr> decorators,
        Integer line
    ) implements Stmt {
        public ClassDef {
            Objects.requireNonNull(name, "name must not be null");
            bases = bases != null ? List.copyOf(bases) : List.of();
            keywords = keywords != null ? List.copyOf(keywords) : List.of();
            body = body != null ? List.copyOf(body) : List.of();
            decorators = decorators != null ? List.copyOf(decorators) : List.of();
        }

        @Override
        public String kind() {
            return "ClassDef";
        }

        @Override
        public List<Node> children() {
            List<Node> children = new ArrayList<>(bases);
            children.addAll(keywords);
            children.addAll(body);
            children.addAll(decorators);
            return children;
        }
    }

    /**
     * An {@code import a.b as c} statement.
     *
     * @param names imported names
     * @param line statement line
     */
    public record Import(List<Alias> names, Integer line) implements Stmt {
        public Import {
            names = names != null ? List.copyOf(names) : List.of();
        }

        @Override
        public String kind() {
            return "Import";
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /**
     * A {@code from module import name} statement.
     *
     * @param module module name, null for {@code from . import x}
     * @param names imported names
     * @param level number of leading dots (0 for absolute imports)
     * @param line statement line
     */
    public record ImportFrom(String module, List<Alias> names, int level, Integer line) implements Stmt {
        public ImportFrom {
            names = names != null ? List.copyOf(names) : List.of();
        }

        @Override
        public String kind() {
            return "ImportFrom";
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /**
     * A plain assignment, possibly chained ({@code a = b = value}).
     *
     * @param targets assignment targets, left to right
     * @param value assigned value
     * @param line statement line
     */
    public record Assign(List<Expr> targets, Expr value, Integer line) implements Stmt {
        public Assign {
            targets = targets != null ? List.copyOf(targets) : List.of();
        }

        @Override
        public String kind() {
            return "Assign";
        }

        @Override
        public List<Node> children() {
            List<Node> children = new ArrayList<>(targets);
            if (value != null) {
                children.add(value);
            }
            return children;
        }
    }

    /**
     * An annotated assignment ({@code name: type = value}); the value is optional.
     *
     * @param target assignment target
     * @param annotation type annotation
     * @param value assigned value (may be null)
     * @param line statement line
     */
    public record AnnAssign(Expr target, Expr annotation, Expr value, Integer line) implements Stmt {

        @Override
        public String kind() {
            return "AnnAssign";
        }

        @Override
        public List<Node> children() {
            List<Node> children = new ArrayList<>();
            if (target != null) {
                children.add(target);
            }
            if (annotation != null) {
                children.add(annotation);
            }
            if (value != null) {
                children.add(value);
            }
            return children;
        }
    }

    /**
     * An {@code if} statement; {@code elif} chains appear as a nested {@code If} in {@code orElse}.
     *
     * @param test condition
     * @param body statements of the true branch
     * @param orElse statements of the false branch
     * @param line statement line
     */
    public record If(Expr test, List<Stmt> body, List<Stmt> orElse, Integer line) implements Stmt {
        public If {
            body = body != null ? List.copyOf(body) : List.of();
            orElse = orElse != null ? List.copyOf(orElse) : List.of();
        }

        @Override
        public String kind() {
            return "If";
        }

        @Override
        public List<Node> children() {
            List<Node> children = new ArrayList<>();
            if (test != null) {
                children.add(test);
            }
            children.addAll(body);
            children.addAll(orElse);
            return children;
        }
    }

    /**
     * An expression used as a statement (calls, docstrings).
     *
     * @param value the expression
     * @param line statement line
     */
    public record ExprStmt(Expr value, Integer line) implements Stmt {

        @Override
        public String kind() {
            return "Expr";
        }

        @Override
        public List<Node> children() {
            return value != null ? List.of(value) : List.of();
        }
    }

    // --- Expressions ---

    /**
     * A literal.
     *
     * <p>{@code value} holds the JSON-representable value ({@link String}, {@link Number},
     * {@link Boolean}) or null for {@code None} and for values with no such representation
     * (bytes, complex numbers, {@code ...}). {@code literal} is the printed form as produced
     * by the parser; when null, it is derived from {@code value}.
     *
     * @param value literal value
     * @param literal printed form (e.g., {@code 'abc'}, {@code 42}, {@code None})
     */
    public record Constant(Object value, String literal) implements Expr {
        public Constant {
            literal = literal != null ? literal : PythonLiterals.repr(value);
        }

        /**
         * Creates a constant whose printed form is derived from its value.
         *
         * @param value literal value
         * @return constant node
         */
        public static Constant of(Object value) {
            return new Constant(value, null);
        }

        @Override
        public String kind() {
            return "Constant";
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /**
     * A bare identifier.
     *
     * @param id identifier text
     */
    public record Name(String id) implements Expr {
        public Name {
            Objects.requireNonNull(id, "id must not be null");
        }

        @Override
        public String kind() {
            return "Name";
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /**
     * Attribute access ({@code value.attr}).
     *
     * @param value accessed expression
     * @param attr attribute name
     */
    public record Attribute(Expr value, String attr) implements Expr {
        public Attribute {
            Objects.requireNonNull(attr, "attr must not be null");
        }

        @Override
        public String kind() {
            return "Attribute";
        }

        @Override
        public List<Node> children() {
            return value != null ? List.of(value) : List.of();
        }
    }

    /**
     * Subscript ({@code value[slice]}).
     *
     * @param value subscripted expression
     * @param slice index expression
     */
    public record Subscript(Expr value, Expr slice) implements Expr {

        @Override
        public String kind() {
            return "Subscript";
        }

        @Override
        public List<Node> children() {
            List<Node> children = new ArrayList<>();
            if (value != null) {
                children.add(value);
            }
            if (slice != null) {
                children.add(slice);
            }
            return children;
        }
    }

    /**
     * Legacy wrapper around a subscript index, emitted by older parsers.
     *
     * @param value wrapped index
     */
    public record Index(Expr value) implements Expr {

        @Override
        public String kind() {
            return "Index";
        }

        @Override
        public List<Node> children() {
            return value != null ? List.of(value) : List.of();
        }
    }

    /**
     * Slice ({@code lower:upper:step}); every part is optional.
     *
     * @param lower lower bound (may be null)
     * @param upper upper bound (may be null)
     * @param step step (may be null)
     */
    public record Slice(Expr lower, Expr upper, Expr step) implements Expr {

        @Override
        public String kind() {
            return "Slice";
        }

        @Override
        public List<Node> children() {
            List<Node> children = new ArrayList<>();
            if (lower != null) {
                children.add(lower);
            }
            if (upper != null) {
                children.add(upper);
            }
            if (step != null) {
                children.add(step);
            }
            return children;
        }
    }

    /**
     * List display ({@code [a, b]}); also a destructuring target.
     *
     * @param elements element expressions
     */
    public record ListExpr(List<Expr> elements) implements Expr {
        public ListExpr {
            elements = elements != null ? List.copyOf(elements) : List.of();
        }

        @Override
        public String kind() {
            return "List";
        }

        @Override
        public List<Node> children() {
            return List.copyOf(elements);
        }
    }

    /**
     * Tuple display ({@code (a, b)}); also a destructuring target.
     *
     * @param elements element expressions
     */
    public record TupleExpr(List<Expr> elements) implements Expr {
        public TupleExpr {
            elements = elements != null ? List.copyOf(elements) : List.of();
        }

        @Override
        public String kind() {
            return "Tuple";
        }

        @Override
        public List<Node> children() {
            return List.copyOf(elements);
        }
    }

    /**
     * Set display ({@code {a, b}}).
     *
     * @param elements element expressions
     */
    public record SetExpr(List<Expr> elements) implements Expr {
        public SetExpr {
            elements = elements != null ? List.copyOf(elements) : List.of();
        }

        @Override
        public String kind() {
            return "Set";
        }

        @Override
        public List<Node> children() {
            return List.copyOf(elements);
        }
    }

    /**
     * Dict display. A null key stands for a {@code **mapping} unpacking entry, so the key
     * list is kept as a plain (null-tolerant) list.
     *
     * @param keys entry keys, null entries allowed
     * @param values entry values
     */
    public record DictExpr(List<Expr> keys, List<Expr> values) implements Expr {
        public DictExpr {
            keys = keys != null ? java.util.Collections.unmodifiableList(new ArrayList<>(keys)) : List.of();
            values = values != null ? List.copyOf(values) : List.of();
        }

        @Override
        public String kind() {
            return "Dict";
        }

        @Override
        public List<Node> children() {
            List<Node> children = new ArrayList<>();
            for (Expr key : keys) {
                if (key != null) {
                    children.add(key);
                }
            }
            children.addAll(values);
            return children;
        }
    }

    /**
     * Call expression.
     *
     * @param func callee
     * @param args positional arguments
     * @param keywords keyword arguments (including {@code **kwargs})
     */
    public record Call(Expr func, List<Expr> args, List<Keyword> keywords) implements Expr {
        public Call {
            args = args != null ? List.copyOf(args) : List.of();
            keywords = keywords != null ? List.copyOf(keywords) : List.of();
        }

        @Override
        public String kind() {
            return "Call";
        }

        @Override
        public List<Node> children() {
            List<Node> children = new ArrayList<>();
            if (func != null) {
                children.add(func);
            }
            children.addAll(args);
            children.addAll(keywords);
            return children;
        }
    }

    /**
     * Binary operation.
     *
     * @param left left operand
     * @param operator operator kind name (e.g., "BitOr", "Add")
     * @param right right operand
     */
    public record BinOp(Expr left, String operator, Expr right) implements Expr {

        /** Operator name of {@code |}. */
        public static final String BIT_OR = "BitOr";

        @Override
        public String kind() {
            return "BinOp";
        }

        @Override
        public List<Node> children() {
            List<Node> children = new ArrayList<>();
            if (left != null) {
                children.add(left);
            }
            if (right != null) {
                children.add(right);
            }
            return children;
        }
    }

    /**
     * Comparison chain ({@code left op1 c1 op2 c2 ...}).
     *
     * @param left leftmost operand
     * @param operators operator kind names (e.g., "Eq", "Lt")
     * @param comparators right-hand operands, one per operator
     */
    public record Compare(Expr left, List<String> operators, List<Expr> comparators) implements Expr {

        /** Operator name of {@code ==}. */
        public static final String EQ = "Eq";

        public Compare {
            operators = operators != null ? List.copyOf(operators) : List.of();
            comparators = comparators != null ? List.copyOf(comparators) : List.of();
        }

        @Override
        public String kind() {
            return "Compare";
        }

        @Override
        public List<Node> children() {
            List<Node> children = new ArrayList<>();
            if (left != null) {
                children.add(left);
            }
            children.addAll(comparators);
            return children;
        }
    }

    // --- Fallback ---

    /**
     * Any node kind outside the modeled subset (loops, {@code try}, lambdas, comprehensions,
     * returns, ...). Children are kept in source field order.
     *
     * @param kind parser class name
     * @param line source line (may be null)
     * @param children child nodes
     */
    public record Opaque(String kind, Integer line, List<Node> children) implements Stmt, Expr {
        public Opaque {
            Objects.requireNonNull(kind, "kind must not be null");
            children = children != null ? List.copyOf(children) : List.of();
        }
    }

    // --- Auxiliary nodes ---

    /**
     * A keyword argument of a call or class definition.
     *
     * @param arg keyword name, null for {@code **mapping}
     * @param value argument value
     */
    public record Keyword(String arg, Expr value) implements Node {

        @Override
        public String kind() {
            return "keyword";
        }

        @Override
        public List<Node> children() {
            return value != null ? List.of(value) : List.of();
        }
    }

    /**
     * One name of an import statement.
     *
     * @param name imported name (e.g., "os.path")
     * @param asName alias (may be null)
     */
    public record Alias(String name, String asName) {
        public Alias {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /**
     * One declared parameter.
     *
     * @param name parameter name
     * @param annotation type annotation (may be null)
     */
    public record Arg(String name, Expr annotation) {
        public Arg {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    /**
     * Parameter list of a function.
     *
     * <p>{@code defaults} align with the tail of positional-only followed by
     * positional-or-keyword parameters. {@code keywordDefaults} align one-to-one with
     * {@code keywordOnly}; a null entry means the parameter has no default.
     *
     * @param positionalOnly parameters before {@code /}
     * @param args positional-or-keyword parameters
     * @param varArg {@code *args} parameter (may be null)
     * @param keywordOnly parameters after {@code *} or {@code *args}
     * @param keywordDefaults defaults of keyword-only parameters, null entries allowed
     * @param kwArg {@code **kwargs} parameter (may be null)
     * @param defaults defaults of the trailing positional parameters
     */
    public record Arguments(
        List<Arg> positionalOnly,
        List<Arg> args,
        Arg varArg,
        List<Arg> keywordOnly,
        List<Expr> keywordDefaults,
        Arg kwArg,
        List<Expr> defaults
    ) {
        public Arguments {
            positionalOnly = positionalOnly != null ? List.copyOf(positionalOnly) : List.of();
            args = args != null ? List.copyOf(args) : List.of();
            keywordOnly = keywordOnly != null ? List.copyOf(keywordOnly) : List.of();
            keywordDefaults = keywordDefaults != null
                ? java.util.Collections.unmodifiableList(new ArrayList<>(keywordDefaults))
                : List.of();
            defaults = defaults != null ? List.copyOf(defaults) : List.of();
        }

        /**
         * Returns an empty parameter list.
         *
         * @return arguments with no parameters
         */
        public static Arguments empty() {
            return new Arguments(List.of(), List.of(), null, List.of(), List.of(), null, List.of());
        }

        /**
         * Returns the default expression of the keyword-only parameter at {@code index}.
         *
         * @param index position in {@link #keywordOnly()}
         * @return default expression, or null
         */
        public Expr keywordDefault(int index) {
            return index < keywordDefaults.size() ? keywordDefaults.get(index) : null;
        }

        List<Node> expressions() {
            List<Node> expressions = new ArrayList<>();
            for (Arg arg : allArgs()) {
                if (arg.annotation() != null) {
                    expressions.add(arg.annotation());
                }
            }
            expressions.addAll(defaults);
            for (Expr keywordDefault : keywordDefaults) {
                if (keywordDefault != null) {
                    expressions.add(keywordDefault);
                }
            }
            return expressions;
        }

        private List<Arg> allArgs() {
            List<Arg> all = new ArrayList<>(positionalOnly);
            all.addAll(args);
            if (varArg != null) {
                all.add(varArg);
            }
            all.addAll(keywordOnly);
            if (kwArg != null) {
                all.add(kwArg);
            }
            return all;
        }
    }
}
