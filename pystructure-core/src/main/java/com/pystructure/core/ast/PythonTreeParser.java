package com.pystructure.core.ast;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Turns a Python source file into a {@link PythonTree.Module}.
 *
 * <p>Parsing is delegated to a collaborator that already validates syntax. Implementations
 * report invalid source through {@link SourceSyntaxException} and keep I/O problems
 * (unreadable file, missing interpreter, malformed tree document) on {@link IOException}.
 *
 * <p><b>Implementations:</b></p>
 * <ul>
 *   <li>{@link ExternalPythonParser} - runs CPython's {@code ast} module on the file</li>
 *   <li>{@link JsonTreeParser} - reads a tree that was dumped beforehand</li>
 * </ul>
 *
 * @since 1.0.0
 */
public interface PythonTreeParser {

    /**
     * Parses a source file.
     *
     * @param sourceFile path to the {@code .py} file
     * @return root of the parsed tree
     * @throws IOException if the file or the parser output cannot be read
     * @throws SourceSyntaxException if the source is not valid Python
     */
    PythonTree.Module parse(Path sourceFile) throws IOException;

    /**
     * Returns a short identifier used in log output.
     *
     * @return parser name
     */
    String getName();
}
