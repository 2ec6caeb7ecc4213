package com.pystructure.core.analyzer;

import com.pystructure.core.analyzer.ScopeStack.Scope;
import com.pystructure.core.ast.PythonTree.Attribute;
import com.pystructure.core.ast.PythonTree.Expr;
import com.pystructure.core.ast.PythonTree.ListExpr;
import com.pystructure.core.ast.PythonTree.Name;
import com.pystructure.core.ast.PythonTree.TupleExpr;
import com.pystructure.core.model.ClassInfo;
import com.pystructure.core.model.FunctionInfo;
import com.pystructure.core.model.FunctionKind;
import com.pystructure.core.model.ModuleStructure;
import com.pystructure.core.model.ScopeRecord;
import com.pystructure.core.model.VariableInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Routes assignment targets into the variable buckets of the right scope record.
 *
 * <p><b>Plain names</b> land in the current scope: constants or global variables at
 * module level (see {@link NamingConventions#isConstantName(String)}), class variables in
 * a class body, local variables in a function.
 *
 * <p><b>Attribute targets on a name</b> are resolved in this order:</p>
 * <ol>
 *   <li>{@code self.attr} in an instance method: instance variable of the nearest class</li>
 *   <li>{@code cls.attr} in a class body or classmethod: class variable of the nearest
 *       class, or a variable named {@code cls.attr} when no class encloses it</li>
 *   <li>{@code ClassName.attr} in the body of {@code ClassName}: class variable</li>
 *   <li>anything else: a variable of the current scope named after the rendered target</li>
 * </ol>
 *
 * <p><b>Tuple and list targets</b> route their plain-name elements; other shapes produce
 * no record.
 *
 * <p>A write into the current scope record is dropped when that record already holds a
 * function, method or class of the same name. Class and instance variables keep the
 * first binding of a name.
 */
public class SymbolRouter {

    private static final Logger log = LoggerFactory.getLogger(SymbolRouter.class);

    private final ScopeStack scopes;

    public SymbolRouter(ScopeStack scopes) {
        this.scopes = Objects.requireNonNull(scopes, "scopes must not be null");
    }

    /**
     * Routes one assignment target.
     *
     * @param target assignment target
     * @param annotation type annotation (may be null)
     * @param line line of the binding statement (may be null)
     */
    public void route(Expr target, Expr annotation, Integer line) {
        if (target instanceof Name name) {
            addVariable(name.id(), annotation, line);
        } else if (target instanceof Attribute attribute && attribute.value() instanceof Name base) {
            routeAttribute(attribute, base.id(), annotation, line);
        } else if (target instanceof TupleExpr tuple) {
            routeElements(tuple.elements(), line);
        } else if (target instanceof ListExpr list) {
            routeElements(list.elements(), line);
        } else if (target != null) {
            log.trace("Ignoring {} assignment target at line {}", target.kind(), line);
        }
    }

    private void routeElements(List<Expr> elements, Integer line) {
        for (Expr element : elements) {
            if (element instanceof Name name) {
                addVariable(name.id(), null, line);
            }
        }
    }

    private void routeAttribute(Attribute target, String base, Expr annotation, Integer line) {
        Scope current = scopes.current();
        FunctionKind functionKind = current.record() instanceof FunctionInfo function ? function.getKind() : null;
        boolean inClassBody = current.kind() == ScopeKind.CLASS;
        Optional<Scope> enclosingClass = scopes.nearestEnclosingClass();
        String attr = target.attr();

        if ("self".equals(base) && functionKind == FunctionKind.INSTANCE_METHOD) {
            enclosingClass.ifPresent(scope -> {
                ClassInfo owner = (ClassInfo) scope.record();
                if (!owner.addInstanceVar(variable(attr, annotation, line))) {
                    log.trace("Instance variable '{}' already recorded on {}", attr, owner.getFullPath());
                }
            });
            return;
        }

        if ("cls".equals(base) && (inClassBody || functionKind == FunctionKind.CLASSMETHOD)) {
            if (enclosingClass.isPresent()) {
                addClassVar((ClassInfo) enclosingClass.get().record(), attr, annotation, line);
            } else {
                addVariable("cls." + attr, annotation, line);
            }
            return;
        }

        if (inClassBody && current.record() instanceof ClassInfo owner && owner.getName().equals(base)) {
            addClassVar(owner, attr, annotation, line);
            return;
        }

        String rendered = NodeRenderer.render(target);
        String name = rendered != null && !rendered.isEmpty() ? rendered : base + "." + attr;
        addVariable(name, annotation, line);
    }

    private void addVariable(String name, Expr annotation, Integer line) {
        Scope current = scopes.current();
        ScopeRecord record = current.record();
        if (shadowsDefinition(record, name)) {
            return;
        }

        VariableInfo variable = variable(name, annotation, line);
        if (record instanceof ModuleStructure module) {
            if (NamingConventions.isConstantName(name)) {
                module.getConstants().add(variable);
            } else {
                module.getGlobalVars().add(variable);
            }
        } else if (record instanceof ClassInfo owner) {
            owner.addClassVar(variable);
        } else if (record instanceof FunctionInfo function) {
            function.getLocalVars().add(variable);
        }
    }

    private void addClassVar(ClassInfo owner, String name, Expr annotation, Integer line) {
        if (owner == scopes.current().record() && shadowsDefinition(owner, name)) {
            return;
        }
        if (!owner.addClassVar(variable(name, annotation, line))) {
            log.trace("Class variable '{}' already recorded on {}", name, owner.getFullPath());
        }
    }

    private static boolean shadowsDefinition(ScopeRecord record, String name) {
        if (record.hasDefinition(name)) {
            log.debug("Skipping variable '{}': shadows a definition in scope '{}'", name, record.getFullPath());
            return true;
        }
        return false;
    }

    private static VariableInfo variable(String name, Expr annotation, Integer line) {
        return new VariableInfo(name, NodeRenderer.render(annotation), line);
    }
}
