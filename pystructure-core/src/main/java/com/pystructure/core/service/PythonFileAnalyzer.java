package com.pystructure.core.service;

import com.pystructure.core.analyzer.StructureAnalyzer;
import com.pystructure.core.ast.PythonTree;
import com.pystructure.core.ast.PythonTreeParser;
import com.pystructure.core.ast.SourceSyntaxException;
import com.pystructure.core.model.ModuleStructure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Validates, parses and analyzes a single Python source file.
 *
 * <p>Never throws for problems with the input: a missing file, a directory, a non-{@code .py}
 * path, a syntax error, a parser failure or an analysis failure all end up as the
 * {@link FileAnalysis#error()} message.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PythonFileAnalyzer analyzer = new PythonFileAnalyzer(new ExternalPythonParser("python3", 30));
 * FileAnalysis analysis = analyzer.analyze(Paths.get("app.py"));
 * if (analysis.hasError()) {
 *     System.err.println(analysis.error());
 * }
 * }</pre>
 */
public class PythonFileAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(PythonFileAnalyzer.class);

    private static final String PYTHON_EXTENSION = ".py";

    private final PythonTreeParser parser;

    public PythonFileAnalyzer(PythonTreeParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    /**
     * Analyzes a file.
     *
     * @param filePath path to the {@code .py} file
     * @return analysis outcome
     */
    public FileAnalysis analyze(Path filePath) {
        String validationError = validate(filePath);
        if (validationError != null) {
            log.warn(validationError);
            return FileAnalysis.failed(filePath, validationError);
        }

        PythonTree.Module tree;
        try {
            log.debug("Parsing {} with {} parser", filePath, parser.getName());
            tree = parser.parse(filePath);
        } catch (SourceSyntaxException e) {
            log.warn("Syntax error in {} at line {}", filePath, e.getLine());
            return FileAnalysis.failed(filePath, syntaxErrorMessage(filePath, e));
        } catch (IOException e) {
            log.error("Failed to parse {}: {}", filePath, e.getMessage());
            return FileAnalysis.failed(filePath, "Unexpected Analysis Error: Failed processing '" + filePath + "'.\n"
                + "  Error: " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        ModuleStructure structure = StructureAnalyzer.analyze(tree);
        log.info("Analyzed {}: {} functions, {} classes", filePath,
            structure.getFunctions().size(), structure.getClasses().size());
        return FileAnalysis.of(filePath, structure);
    }

    static String validate(Path filePath) {
        if (!Files.exists(filePath)) {
            return "Error: File not found at '" + filePath + "'";
        }
        if (!Files.isRegularFile(filePath)) {
            return "Error: Input path '" + filePath + "' is a directory, not a file.";
        }
        if (!filePath.toString().toLowerCase(Locale.ROOT).endsWith(PYTHON_EXTENSION)) {
            return "Error: Input path '" + filePath + "' does not appear to be a Python file (.py extension).";
        }
        return null;
    }

    static String syntaxErrorMessage(Path filePath, SourceSyntaxException e) {
        String context = e.getSourceLine() != null && !e.getSourceLine().isBlank()
            ? e.getSourceLine().strip()
            : "<source line unavailable>";
        return "Syntax Error: Invalid Python syntax in '" + filePath + "' near line "
            + e.getLine() + " column " + e.getColumn() + ":\n"
            + "  Detail: " + e.getDescription() + "\n"
            + "  Context: " + context;
    }
}
