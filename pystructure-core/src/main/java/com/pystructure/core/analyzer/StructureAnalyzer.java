package com.pystructure.core.analyzer;

import com.pystructure.core.analyzer.ScopeStack.Scope;
import com.pystructure.core.ast.PythonTree;
import com.pystructure.core.ast.PythonTree.AnnAssign;
import com.pystructure.core.ast.PythonTree.Assign;
import com.pystructure.core.ast.PythonTree.ClassDef;
import com.pystructure.core.ast.PythonTree.Compare;
import com.pystructure.core.ast.PythonTree.Constant;
import com.pystructure.core.ast.PythonTree.Expr;
import com.pystructure.core.ast.PythonTree.FunctionDef;
import com.pystructure.core.ast.PythonTree.If;
import com.pystructure.core.ast.PythonTree.Import;
import com.pystructure.core.ast.PythonTree.ImportFrom;
import com.pystructure.core.ast.PythonTree.Name;
import com.pystructure.core.ast.PythonTree.Node;
import com.pystructure.core.ast.PythonTree.Stmt;
import com.pystructure.core.model.ClassInfo;
import com.pystructure.core.model.FunctionInfo;
import com.pystructure.core.model.FunctionKind;
import com.pystructure.core.model.ImportInfo;
import com.pystructure.core.model.ModuleStructure;
import com.pystructure.core.model.ScopeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks a parsed module and builds its {@link ModuleStructure}.
 *
 * <p>Traversal is depth-first and pre-order. Definitions, imports, assignments and
 * {@code if} statements get dedicated handling; every other node is descended into
 * generically, so definitions inside loops, {@code try} or {@code with} blocks are still
 * found. A function or class record is registered in its parent before its body is
 * walked.
 *
 * <p>An instance is single-use; {@link #analyze(PythonTree.Module)} creates one per run.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PythonTree.Module tree = parser.parse(Paths.get("service.py"));
 * ModuleStructure structure = StructureAnalyzer.analyze(tree);
 * structure.getClasses().get("Service").getMethods().keySet();
 * }</pre>
 *
 * @see SymbolRouter
 * @see NodeRenderer
 */
public final class StructureAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(StructureAnalyzer.class);

    static final String ERROR_PREFIX = "Unexpected Analysis Error: ";

    private static final String MAIN_MODULE = "__main__";
    private static final String NAME_DUNDER = "__name__";

    private final ModuleStructure root = new ModuleStructure();
    private final ScopeStack scopes = new ScopeStack(root);
    private final SymbolRouter router = new SymbolRouter(scopes);

    private StructureAnalyzer() {
    }

    /**
     * Analyzes a parsed module.
     *
     * <p>A failure during traversal does not propagate: it is stored as the record's
     * analysis error and the record gathered up to that point is returned.
     *
     * @param module parsed module
     * @return the module's structure
     */
    public static ModuleStructure analyze(PythonTree.Module module) {
        StructureAnalyzer analyzer = new StructureAnalyzer();
        try {
            analyzer.visit(module);
        } catch (RuntimeException | StackOverflowError e) {
            log.error("Analysis aborted: {}", e.toString());
            analyzer.root.setAnalysisError(describeFailure(e));
        }
        return analyzer.root;
    }

    private void visit(Node node) {
        if (node instanceof PythonTree.Module module) {
            visitModule(module);
        } else if (node instanceof FunctionDef function) {
            visitFunction(function);
        } else if (node instanceof ClassDef classDef) {
            visitClass(classDef);
        } else if (node instanceof Import importStmt) {
            visitImport(importStmt);
        } else if (node instanceof ImportFrom importFrom) {
            visitImportFrom(importFrom);
        } else if (node instanceof Assign assign) {
            visitAssign(assign);
        } else if (node instanceof AnnAssign annAssign) {
            visitAnnAssign(annAssign);
        } else if (node instanceof If ifStmt) {
            visitIf(ifStmt);
        } else {
            visitChildren(node);
        }
    }

    private void visitChildren(Node node) {
        for (Node child : node.children()) {
            if (child != null) {
                visit(child);
            }
        }
    }

    private void visitModule(PythonTree.Module module) {
        root.setModuleDocstring(Docstrings.extract(module.body()));
        visitChildren(module);
    }

    private void visitImport(Import importStmt) {
        for (PythonTree.Alias alias : importStmt.names()) {
            root.getImports().add(new ImportInfo(alias.name(), alias.asName(), importStmt.line()));
        }
    }

    private void visitImportFrom(ImportFrom importFrom) {
        String module = ".".repeat(importFrom.level()) + (importFrom.module() != null ? importFrom.module() : "");
        List<ImportInfo> imports = root.getFromImports().computeIfAbsent(module, k -> new ArrayList<>());
        for (PythonTree.Alias alias : importFrom.names()) {
            imports.add(new ImportInfo(alias.name(), alias.asName(), importFrom.line()));
        }
    }

    private void visitFunction(FunctionDef function) {
        Scope parent = scopes.current();
        List<String> decorators = renderAll(function.decorators());
        FunctionKind kind = FunctionKindResolver.resolve(parent.kind(), decorators, function.arguments());

        FunctionInfo info = new FunctionInfo(
            function.name(),
            function.line(),
            kind,
            function.async(),
            ParameterExtractor.extract(function.arguments()),
            NodeRenderer.render(function.returns()),
            decorators,
            Docstrings.extract(function.body())
        );

        ScopeRecord owner = parent.record();
        if (owner instanceof ModuleStructure module) {
            module.getFunctions().put(function.name(), info);
        } else if (owner instanceof ClassInfo classInfo) {
            classInfo.getMethods().put(function.name(), info);
        } else if (owner instanceof FunctionInfo enclosing) {
            enclosing.getNestedFunctions().put(function.name(), info);
        }

        walkBody(info, ScopeKind.FUNCTION, function.name(), function.body());
    }

    private void visitClass(ClassDef classDef) {
        ClassInfo info = new ClassInfo(
            classDef.name(),
            classDef.line(),
            renderAll(classDef.bases()),
            renderAll(classDef.decorators()),
            Docstrings.extract(classDef.body())
        );

        ScopeRecord owner = scopes.current().record();
        if (owner instanceof ModuleStructure module) {
            module.getClasses().put(classDef.name(), info);
        } else if (owner instanceof ClassInfo enclosing) {
            enclosing.getNestedClasses().put(classDef.name(), info);
        } else if (owner instanceof FunctionInfo enclosing) {
            enclosing.getNestedClasses().put(classDef.name(), info);
        }

        walkBody(info, ScopeKind.CLASS, classDef.name(), classDef.body());
    }

    private void walkBody(ScopeRecord record, ScopeKind kind, String name, List<Stmt> body) {
        scopes.push(record, kind, name);
        try {
            for (Stmt statement : body) {
                visit(statement);
            }
        } finally {
            scopes.pop();
        }
    }

    private void visitAssign(Assign assign) {
        for (Expr target : assign.targets()) {
            router.route(target, null, assign.line());
        }
        if (assign.value() != null) {
            visit(assign.value());
        }
    }

    private void visitAnnAssign(AnnAssign annAssign) {
        router.route(annAssign.target(), annAssign.annotation(), annAssign.line());
        if (annAssign.value() != null) {
            visit(annAssign.value());
        }
        if (annAssign.annotation() != null) {
            visit(annAssign.annotation());
        }
    }

    private void visitIf(If ifStmt) {
        if (isMainGuard(ifStmt.test())) {
            log.debug("Found main guard at line {}", ifStmt.line());
            root.markMainBlock();
        }
        visitChildren(ifStmt);
    }

    /**
     * Matches {@code __name__ == "__main__"} and {@code "__main__" == __name__}.
     */
    static boolean isMainGuard(Expr test) {
        if (!(test instanceof Compare compare)) {
            return false;
        }
        if (compare.operators().size() != 1 || !Compare.EQ.equals(compare.operators().get(0))
            || compare.comparators().size() != 1) {
            return false;
        }
        Expr left = compare.left();
        Expr right = compare.comparators().get(0);
        return (isNameDunder(left) && isMainLiteral(right)) || (isMainLiteral(left) && isNameDunder(right));
    }

    private static boolean isNameDunder(Expr expr) {
        return expr instanceof Name name && NAME_DUNDER.equals(name.id());
    }

    private static boolean isMainLiteral(Expr expr) {
        return expr instanceof Constant constant && MAIN_MODULE.equals(constant.value());
    }

    private static List<String> renderAll(List<Expr> expressions) {
        List<String> rendered = new ArrayList<>(expressions.size());
        for (Expr expression : expressions) {
            String text = NodeRenderer.render(expression);
            if (text != null && !text.isEmpty()) {
                rendered.add(text);
            }
        }
        return rendered;
    }

    private static String describeFailure(Throwable failure) {
        StringWriter trace = new StringWriter();
        failure.printStackTrace(new PrintWriter(trace));
        return ERROR_PREFIX + failure.getClass().getSimpleName() + ": " + failure.getMessage()
            + "\nTraceback:\n" + trace;
    }
}
