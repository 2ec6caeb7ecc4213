package com.pystructure.core.report;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ReportSorterTest {

    @Test
    void sortScope_ordersVariablesByLineThenName() {
        Map<String, Object> scope = new LinkedHashMap<>();
        scope.put("global_vars", new ArrayList<>(List.of(
            variable("zeta", 4),
            variable("beta", 2),
            variable("alpha", 2),
            variable("cls.counter", null))));

        ReportSorter.sortScope(scope);

        assertThat(names(scope.get("global_vars"))).containsExactly("cls.counter", "alpha", "beta", "zeta");
    }

    @Test
    void sortScope_ordersEachFromImportList() {
        Map<String, Object> fromImports = new LinkedHashMap<>();
        fromImports.put("typing", List.of(variable("Optional", 3), variable("Dict", 1)));
        Map<String, Object> scope = new LinkedHashMap<>();
        scope.put("from_imports", fromImports);

        ReportSorter.sortScope(scope);

        @SuppressWarnings("unchecked")
        Map<String, Object> sorted = (Map<String, Object>) scope.get("from_imports");
        assertThat(names(sorted.get("typing"))).containsExactly("Dict", "Optional");
    }

    @Test
    void sortScope_ordersNestedScopesByNameRecursively() {
        Map<String, Object> method = new LinkedHashMap<>();
        method.put("local_vars", List.of(variable("b", 9), variable("a", 8)));
        Map<String, Object> methods = new LinkedHashMap<>();
        methods.put("run", method);
        methods.put("close", new LinkedHashMap<>());
        Map<String, Object> worker = new LinkedHashMap<>();
        worker.put("methods", methods);
        Map<String, Object> classes = new HashMap<>();
        classes.put("Worker", worker);
        classes.put("Pool", new LinkedHashMap<>());
        Map<String, Object> scope = new LinkedHashMap<>();
        scope.put("classes", classes);

        ReportSorter.sortScope(scope);

        Map<?, ?> sortedClasses = (Map<?, ?>) scope.get("classes");
        assertThat(keys(sortedClasses)).containsExactly("Pool", "Worker");
        Map<?, ?> sortedMethods = (Map<?, ?>) ((Map<?, ?>) sortedClasses.get("Worker")).get("methods");
        assertThat(keys(sortedMethods)).containsExactly("close", "run");
        assertThat(names(((Map<?, ?>) sortedMethods.get("run")).get("local_vars"))).containsExactly("a", "b");
    }

    @Test
    void sortScope_leavesParameterOrderAlone() {
        Map<String, Object> function = new LinkedHashMap<>();
        function.put("params", List.of(variable("self", null), variable("args", null)));
        Map<String, Object> scope = new LinkedHashMap<>();
        scope.put("functions", Map.of("run", function));

        ReportSorter.sortScope(scope);

        Map<?, ?> run = (Map<?, ?>) ((Map<?, ?>) scope.get("functions")).get("run");
        assertThat(names(run.get("params"))).containsExactly("self", "args");
    }

    @Test
    void withoutNulls_dropsNullValuesAndElementsRecursively() {
        Map<String, Object> inner = new LinkedHashMap<>();
        inner.put("name", "x");
        inner.put("type", null);
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("module_docstring", null);
        report.put("constants", Arrays.asList(inner, null));
        report.put("functions", Map.of());

        Object cleaned = ReportSorter.withoutNulls(report);

        assertThat(cleaned).isEqualTo(Map.of(
            "constants", List.of(Map.of("name", "x")),
            "functions", Map.of()));
    }

    private static Map<String, Object> variable(String name, Integer line) {
        Map<String, Object> variable = new LinkedHashMap<>();
        variable.put("name", name);
        variable.put("line", line);
        return variable;
    }

    private static List<Object> keys(Map<?, ?> map) {
        return new ArrayList<>(map.keySet());
    }

    private static List<Object> names(Object list) {
        List<Object> names = new ArrayList<>();
        for (Object entry : (List<?>) list) {
            names.add(((Map<?, ?>) entry).get("name"));
        }
        return names;
    }
}
