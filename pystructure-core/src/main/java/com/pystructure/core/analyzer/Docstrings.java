package com.pystructure.core.analyzer;

import com.pystructure.core.ast.PythonTree.Constant;
import com.pystructure.core.ast.PythonTree.ExprStmt;
import com.pystructure.core.ast.PythonTree.Stmt;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Docstring extraction for modules, classes and functions.
 */
public final class Docstrings {

    private static final int TAB_SIZE = 8;

    private Docstrings() {
        // Utility class
    }

    /**
     * Returns the cleaned docstring of a body: the leading statement when it is a string
     * literal used as an expression.
     *
     * @param body statements of a module, class or function
     * @return cleaned docstring, or null when the body has none
     */
    public static String extract(List<Stmt> body) {
        if (body.isEmpty() || !(body.get(0) instanceof ExprStmt statement)) {
            return null;
        }
        if (statement.value() instanceof Constant constant && constant.value() instanceof String text) {
            return clean(text);
        }
        return null;
    }

    /**
     * Cleans up docstring indentation: tabs are expanded, the first line is stripped of
     * leading whitespace, the common indentation of the remaining lines is removed, and
     * leading and trailing blank lines are dropped.
     *
     * @param docstring raw docstring text
     * @return cleaned text
     */
    public static String clean(String docstring) {
        List<String> lines = new ArrayList<>(Arrays.asList(expandTabs(docstring).split("\n", -1)));

        int margin = Integer.MAX_VALUE;
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            int content = stripLeadingSpace(line).length();
            if (content > 0) {
                margin = Math.min(margin, line.length() - content);
            }
        }

        lines.set(0, stripLeadingSpace(lines.get(0)));
        if (margin < Integer.MAX_VALUE) {
            for (int i = 1; i < lines.size(); i++) {
                String line = lines.get(i);
                lines.set(i, line.substring(Math.min(margin, line.length())));
            }
        }

        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        while (!lines.isEmpty() && lines.get(0).isEmpty()) {
            lines.remove(0);
        }
        return String.join("\n", lines);
    }

    // Python's str.isspace also accepts no-break spaces and NEL, which Character.isWhitespace rejects.
    static String stripLeadingSpace(String text) {
        int start = 0;
        while (start < text.length() && isPythonSpace(text.charAt(start))) {
            start++;
        }
        return text.substring(start);
    }

    private static boolean isPythonSpace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\u0085';
    }

    // Column resets after every line break, as in str.expandtabs().
    static String expandTabs(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        int column = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\t') {
                int spaces = TAB_SIZE - (column % TAB_SIZE);
                sb.append(" ".repeat(spaces));
                column += spaces;
            } else if (c == '\n' || c == '\r') {
                sb.append(c);
                column = 0;
            } else {
                sb.append(c);
                column++;
            }
        }
        return sb.toString();
    }
}
