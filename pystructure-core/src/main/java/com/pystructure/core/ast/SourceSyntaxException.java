package com.pystructure.core.ast;

/**
 * Thrown by a {@link PythonTreeParser} when the source text is not valid Python.
 *
 * <p>Carries the parser's own diagnosis: position, a short description and the offending
 * source line. Position fields may be null when the parser could not locate the error.
 */
public class SourceSyntaxException extends RuntimeException {

    private final Integer line;
    private final Integer column;
    private final String description;
    private final String sourceLine;

    public SourceSyntaxException(Integer line, Integer column, String description, String sourceLine) {
        super("Invalid syntax at line " + line + ", column " + column + ": " + description);
        this.line = line;
        this.column = column;
        this.description = description;
        this.sourceLine = sourceLine;
    }

    public Integer getLine() {
        return line;
    }

    public Integer getColumn() {
        return column;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Returns the offending source line as reported by the parser.
     *
     * @return source line text, or null when unavailable
     */
    public String getSourceLine() {
        return sourceLine;
    }
}
