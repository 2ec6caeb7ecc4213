package com.pystructure.core.report;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Normalizes a report tree for stable output.
 *
 * <p>Works on the generic map view of a {@link com.pystructure.core.model.ModuleStructure}:
 * variable and import lists are ordered by line (absent line = 0) then name, name-keyed
 * maps of functions, methods and classes are ordered by name, and both rules apply
 * recursively to nested scopes. Parameter and decorator lists keep source order.
 */
public final class ReportSorter {

    private static final List<String> VARIABLE_LISTS = List.of(
        "constants", "global_vars", "class_vars", "instance_vars", "local_vars", "imports"
    );

    private static final List<String> SCOPE_MAPS = List.of(
        "functions", "methods", "nested_functions", "classes", "nested_classes"
    );

    private static final String FROM_IMPORTS = "from_imports";

    private static final Comparator<Object> BY_LINE_THEN_NAME = Comparator
        .comparingInt(ReportSorter::lineOf)
        .thenComparing(ReportSorter::nameOf);

    private ReportSorter() {
        // Utility class
    }

    /**
     * Sorts a scope map in place, recursing into nested scopes.
     *
     * @param scope map view of a module, class or function record
     */
    @SuppressWarnings("unchecked")
    public static void sortScope(Map<String, Object> scope) {
        for (String key : VARIABLE_LISTS) {
            if (scope.get(key) instanceof List<?> list) {
                scope.put(key, sorted(list));
            }
        }

        if (scope.get(FROM_IMPORTS) instanceof Map<?, ?> fromImports) {
            Map<Object, Object> sortedImports = new LinkedHashMap<>();
            fromImports.forEach((module, imports) ->
                sortedImports.put(module, imports instanceof List<?> list ? sorted(list) : imports));
            scope.put(FROM_IMPORTS, sortedImports);
        }

        for (String key : SCOPE_MAPS) {
            if (scope.get(key) instanceof Map<?, ?> children) {
                Map<String, Object> byName = new TreeMap<>();
                children.forEach((name, child) -> {
                    if (child instanceof Map<?, ?> childScope) {
                        sortScope((Map<String, Object>) childScope);
                    }
                    byName.put(String.valueOf(name), child);
                });
                scope.put(key, new LinkedHashMap<>(byName));
            }
        }
    }

    /**
     * Returns a copy of a report value with every null map value and null list element
     * removed, recursively. Empty maps and lists are kept.
     *
     * @param value map, list or scalar
     * @return cleaned copy
     */
    public static Object withoutNulls(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> cleaned = new LinkedHashMap<>();
            map.forEach((key, entry) -> {
                if (entry != null) {
                    cleaned.put(key, withoutNulls(entry));
                }
            });
            return cleaned;
        }
        if (value instanceof List<?> list) {
            List<Object> cleaned = new ArrayList<>(list.size());
            for (Object element : list) {
                if (element != null) {
                    cleaned.add(withoutNulls(element));
                }
            }
            return cleaned;
        }
        return value;
    }

    private static List<Object> sorted(List<?> list) {
        List<Object> copy = new ArrayList<>(list);
        copy.sort(BY_LINE_THEN_NAME);
        return copy;
    }

    private static int lineOf(Object entry) {
        if (entry instanceof Map<?, ?> map && map.get("line") instanceof Number line) {
            return line.intValue();
        }
        return 0;
    }

    private static String nameOf(Object entry) {
        if (entry instanceof Map<?, ?> map && map.get("name") != null) {
            return String.valueOf(map.get("name"));
        }
        return "";
    }
}
