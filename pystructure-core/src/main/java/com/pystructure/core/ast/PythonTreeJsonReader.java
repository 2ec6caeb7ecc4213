package com.pystructure.core.ast;

import com.fasterxml.jackson.databind.JsonNode;
import com.pystructure.core.ast.PythonTree.Alias;
import com.pystructure.core.ast.PythonTree.AnnAssign;
import com.pystructure.core.ast.PythonTree.Arg;
import com.pystructure.core.ast.PythonTree.Arguments;
import com.pystructure.core.ast.PythonTree.Assign;
import com.pystructure.core.ast.PythonTree.Attribute;
import com.pystructure.core.ast.PythonTree.BinOp;
import com.pystructure.core.ast.PythonTree.Call;
import com.pystructure.core.ast.PythonTree.ClassDef;
import com.pystructure.core.ast.PythonTree.Compare;
import com.pystructure.core.ast.PythonTree.Constant;
import com.pystructure.core.ast.PythonTree.DictExpr;
import com.pystructure.core.ast.PythonTree.Expr;
import com.pystructure.core.ast.PythonTree.ExprStmt;
import com.pystructure.core.ast.PythonTree.FunctionDef;
import com.pystructure.core.ast.PythonTree.If;
import com.pystructure.core.ast.PythonTree.Import;
import com.pystructure.core.ast.PythonTree.ImportFrom;
import com.pystructure.core.ast.PythonTree.Index;
import com.pystructure.core.ast.PythonTree.Keyword;
import com.pystructure.core.ast.PythonTree.ListExpr;
import com.pystructure.core.ast.PythonTree.Module;
import com.pystructure.core.ast.PythonTree.Name;
import com.pystructure.core.ast.PythonTree.Node;
import com.pystructure.core.ast.PythonTree.Opaque;
import com.pystructure.core.ast.PythonTree.SetExpr;
import com.pystructure.core.ast.PythonTree.Slice;
import com.pystructure.core.ast.PythonTree.Stmt;
import com.pystructure.core.ast.PythonTree.Subscript;
import com.pystructure.core.ast.PythonTree.TupleExpr;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts a JSON-serialized CPython {@code ast} tree into {@link PythonTree} nodes.
 *
 * <p><b>Document format:</b> every node is an object whose {@code _type} is the CPython
 * class name, with one property per entry of the class's {@code _fields} plus
 * {@code lineno} when the node has a position. Constants additionally carry {@code repr},
 * the printed form of the value. A syntax error is reported as the single object
 * <pre>{@code
 * {"_type": "SyntaxError", "lineno": 3, "offset": 9, "msg": "invalid syntax", "text": "def f(:\n"}
 * }</pre>
 *
 * <p>Node kinds outside the modeled subset become {@link Opaque} nodes whose children are
 * collected from every object-valued or array-valued property, in document order.
 * Pre-3.8 literal nodes ({@code Str}, {@code Num}, {@code Bytes}, {@code NameConstant},
 * {@code Ellipsis}) are read as {@link Constant}.
 *
 * @see ExternalPythonParser
 * @since 1.0.0
 */
public class PythonTreeJsonReader {

    private static final String TYPE = "_type";
    private static final String LINE = "lineno";
    private static final String SYNTAX_ERROR = "SyntaxError";

    // Positional and context properties that never hold child nodes
    private static final Set<String> NON_CHILD_PROPERTIES = Set.of(
        TYPE, LINE, "col_offset", "end_lineno", "end_col_offset", "ctx", "type_comment", "repr"
    );

    /**
     * Reads a tree document.
     *
     * @param document root JSON object ({@code Module} or {@code SyntaxError})
     * @return parsed module
     * @throws SourceSyntaxException if the document reports a syntax error
     * @throws IOException if the document is not a module tree
     */
    public Module readDocument(JsonNode document) throws IOException {
        if (document == null || !document.isObject()) {
            throw new IOException("Tree document must be a JSON object");
        }
        String type = typeOf(document);
        if (SYNTAX_ERROR.equals(type)) {
            throw new SourceSyntaxException(
                intOrNull(document.get(LINE)),
                intOrNull(document.get("offset")),
                textOrNull(document.get("msg")),
                textOrNull(document.get("text"))
            );
        }
        if (!"Module".equals(type)) {
            throw new IOException("Expected a Module tree but found: " + type);
        }
        return readModule(document);
    }

    private Module readModule(JsonNode json) {
        return new Module(readStatements(json.get("body")));
    }

    /**
     * Reads any node, dispatching on {@code _type}.
     */
    Node readNode(JsonNode json) {
        String type = typeOf(json);
        return switch (type) {
            case "Module" -> readModule(json);
            case "FunctionDef" -> readFunction(json, false);
            case "AsyncFunctionDef" -> readFunction(json, true);
            case "ClassDef" -> readClass(json);
            case "Import" -> new Import(readAliases(json.get("names")), line(json));
            case "ImportFrom" -> new ImportFrom(
                textOrNull(json.get("module")),
                readAliases(json.get("names")),
                json.path("level").asInt(0),
                line(json));
            case "Assign" -> new Assign(readExpressions(json.get("targets")), readExpr(json.get("value")), line(json));
            case "AnnAssign" -> new AnnAssign(
                readExpr(json.get("target")),
                readExpr(json.get("annotation")),
                readExpr(json.get("value")),
                line(json));
            case "If" -> new If(
                readExpr(json.get("test")),
                readStatements(json.get("body")),
                readStatements(json.get("orelse")),
                line(json));
            case "Expr" -> new ExprStmt(readExpr(json.get("value")), line(json));
            case "Constant" -> readConstant(json, json.get("value"));
            case "Str", "Bytes" -> readConstant(json, json.get("s"));
            case "Num" -> readConstant(json, json.get("n"));
            case "NameConstant" -> readConstant(json, json.get("value"));
            case "Ellipsis" -> new Constant(null, "Ellipsis");
            case "Name" -> new Name(json.path("id").asText());
            case "Attribute" -> new Attribute(readExpr(json.get("value")), json.path("attr").asText());
            case "Subscript" -> new Subscript(readExpr(json.get("value")), readExpr(json.get("slice")));
            case "Index" -> new Index(readExpr(json.get("value")));
            case "Slice" -> new Slice(
                readExpr(json.get("lower")),
                readExpr(json.get("upper")),
                readExpr(json.get("step")));
            case "List" -> new ListExpr(readExpressions(json.get("elts")));
            case "Tuple" -> new TupleExpr(readExpressions(json.get("elts")));
            case "Set" -> new SetExpr(readExpressions(json.get("elts")));
            case "Dict" -> new DictExpr(readExpressions(json.get("keys")), readExpressions(json.get("values")));
            case "Call" -> new Call(
                readExpr(json.get("func")),
                readExpressions(json.get("args")),
                readKeywords(json.get("keywords")));
            case "BinOp" -> new BinOp(
                readExpr(json.get("left")),
                typeOf(json.get("op")),
                readExpr(json.get("right")));
            case "Compare" -> new Compare(
                readExpr(json.get("left")),
                readOperators(json.get("ops")),
                readExpressions(json.get("comparators")));
            case "keyword" -> new Keyword(textOrNull(json.get("arg")), readExpr(json.get("value")));
            default -> readOpaque(json, type);
        };
    }

    private FunctionDef readFunction(JsonNode json, boolean async) {
        return new FunctionDef(
            json.path("name").asText(),
            readArguments(json.get("args")),
            readStatements(json.get("body")),
            readExpressions(json.get("decorator_list")),
            readExpr(json.get("returns")),
            async,
            line(json)
        );
    }

    private ClassDef readClass(JsonNode json) {
        return new ClassDef(
            json.path("name").asText(),
            readExpressions(json.get("bases")),
            readKeywords(json.get("keywords")),
            readStatements(json.get("body")),
            readExpressions(json.get("decorator_list")),
            line(json)
        );
    }

    private Arguments readArguments(JsonNode json) {
        if (json == null || !json.isObject()) {
            return Arguments.empty();
        }
        return new Arguments(
            readArgs(json.get("posonlyargs")),
            readArgs(json.get("args")),
            readArg(json.get("vararg")),
            readArgs(json.get("kwonlyargs")),
            readExpressions(json.get("kw_defaults")),
            readArg(json.get("kwarg")),
            readExpressions(json.get("defaults"))
        );
    }

    private List<Arg> readArgs(JsonNode array) {
        List<Arg> args = new ArrayList<>();
        if (array != null && array.isArray()) {
            for (JsonNode element : array) {
                Arg arg = readArg(element);
                if (arg != null) {
                    args.add(arg);
                }
            }
        }
        return args;
    }

    private Arg readArg(JsonNode json) {
        if (json == null || !json.isObject()) {
            return null;
        }
        return new Arg(json.path("arg").asText(), readExpr(json.get("annotation")));
    }

    private Constant readConstant(JsonNode json, JsonNode value) {
        return new Constant(scalarValue(value), textOrNull(json.get("repr")));
    }

    private Object scalarValue(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual()) {
            return value.asText();
        }
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        if (value.isNumber()) {
            return value.numberValue();
        }
        return null;
    }

    private List<Alias> readAliases(JsonNode array) {
        List<Alias> aliases = new ArrayList<>();
        if (array != null && array.isArray()) {
            for (JsonNode element : array) {
                aliases.add(new Alias(element.path("name").asText(), textOrNull(element.get("asname"))));
            }
        }
        return aliases;
    }

    private List<Keyword> readKeywords(JsonNode array) {
        List<Keyword> keywords = new ArrayList<>();
        if (array != null && array.isArray()) {
            for (JsonNode element : array) {
                keywords.add(new Keyword(textOrNull(element.get("arg")), readExpr(element.get("value"))));
            }
        }
        return keywords;
    }

    private List<String> readOperators(JsonNode array) {
        List<String> operators = new ArrayList<>();
        if (array != null && array.isArray()) {
            for (JsonNode element : array) {
                operators.add(typeOf(element));
            }
        }
        return operators;
    }

    private List<Stmt> readStatements(JsonNode array) {
        List<Stmt> statements = new ArrayList<>();
        if (array != null && array.isArray()) {
            for (JsonNode element : array) {
                statements.add(asStatement(readNode(element)));
            }
        }
        return statements;
    }

    /**
     * Reads an expression list; JSON nulls are kept as null entries (dict unpacking keys,
     * keyword-only parameters without default).
     */
    private List<Expr> readExpressions(JsonNode array) {
        List<Expr> expressions = new ArrayList<>();
        if (array != null && array.isArray()) {
            for (JsonNode element : array) {
                expressions.add(readExpr(element));
            }
        }
        return expressions;
    }

    private Expr readExpr(JsonNode json) {
        if (json == null || json.isNull()) {
            return null;
        }
        return asExpression(readNode(json));
    }

    private Opaque readOpaque(JsonNode json, String type) {
        List<Node> children = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (NON_CHILD_PROPERTIES.contains(field.getKey())) {
                continue;
            }
            collectChildren(field.getValue(), children);
        }
        return new Opaque(type, line(json), children);
    }

    private void collectChildren(JsonNode value, List<Node> children) {
        if (value == null) {
            return;
        }
        if (value.isObject() && value.has(TYPE)) {
            children.add(readNode(value));
        } else if (value.isArray()) {
            for (JsonNode element : value) {
                collectChildren(element, children);
            }
        }
    }

    private static Stmt asStatement(Node node) {
        if (node instanceof Stmt statement) {
            return statement;
        }
        return new Opaque(node.kind(), null, List.of(node));
    }

    private static Expr asExpression(Node node) {
        if (node instanceof Expr expression) {
            return expression;
        }
        return new Opaque(node.kind(), null, List.of(node));
    }

    private static String typeOf(JsonNode json) {
        if (json == null || !json.isObject()) {
            return "None";
        }
        return json.path(TYPE).asText("Unknown");
    }

    private static Integer line(JsonNode json) {
        return intOrNull(json.get(LINE));
    }

    private static Integer intOrNull(JsonNode value) {
        return value != null && value.isNumber() ? value.intValue() : null;
    }

    private static String textOrNull(JsonNode value) {
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
