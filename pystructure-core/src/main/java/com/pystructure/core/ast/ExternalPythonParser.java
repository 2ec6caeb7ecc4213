package com.pystructure.core.ast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link PythonTreeParser} backed by CPython's own {@code ast} module.
 *
 * <p>The bundled {@code ast_dump.py} script is extracted to a temporary file and run with
 * the configured interpreter. The script writes the tree (or the syntax error) as JSON,
 * which is then read by {@link PythonTreeJsonReader}.
 *
 * <p><b>Failure modes:</b></p>
 * <ul>
 *   <li>invalid source - {@link SourceSyntaxException} carrying the interpreter's diagnosis</li>
 *   <li>interpreter missing, non-zero exit or timeout - {@link IOException}</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PythonTreeParser parser = new ExternalPythonParser("python3", 30);
 * PythonTree.Module module = parser.parse(Paths.get("app.py"));
 * }</pre>
 *
 * @since 1.0.0
 */
public class ExternalPythonParser implements PythonTreeParser {

    private static final Logger log = LoggerFactory.getLogger(ExternalPythonParser.class);

    private static final String DUMPER_RESOURCE = "/pystructure/ast_dump.py";
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final String pythonExecutable;
    private final long timeoutSeconds;
    private final PythonTreeJsonReader reader = new PythonTreeJsonReader();

    /**
     * Creates a parser.
     *
     * @param pythonExecutable interpreter command (e.g., "python3" or an absolute path)
     * @param timeoutSeconds maximum time allowed for one parse
     */
    public ExternalPythonParser(String pythonExecutable, long timeoutSeconds) {
        this.pythonExecutable = Objects.requireNonNull(pythonExecutable, "pythonExecutable must not be null");
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive: " + timeoutSeconds);
        }
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public String getName() {
        return "cpython";
    }

    @Override
    public PythonTree.Module parse(Path sourceFile) throws IOException {
        Path script = Files.createTempFile("pystructure-ast-dump-", ".py");
        Path treeFile = Files.createTempFile("pystructure-tree-", ".json");
        Path errFile = Files.createTempFile("pystructure-stderr-", ".log");

        try {
            extractDumper(script);
            runDumper(script, sourceFile, treeFile, errFile);

            JsonNode document = OBJECT_MAPPER.readTree(treeFile.toFile());
            return reader.readDocument(document);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Python parser interrupted", e);
        } finally {
            Files.deleteIfExists(script);
            Files.deleteIfExists(treeFile);
            Files.deleteIfExists(errFile);
        }
    }

    private void extractDumper(Path target) throws IOException {
        try (InputStream in = ExternalPythonParser.class.getResourceAsStream(DUMPER_RESOURCE)) {
            if (in == null) {
                throw new IOException("Bundled resource not found: " + DUMPER_RESOURCE);
            }
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void runDumper(Path script, Path sourceFile, Path treeFile, Path errFile)
            throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(
            pythonExecutable,
            script.toAbsolutePath().toString(),
            sourceFile.toAbsolutePath().toString()
        );
        // Both streams go to files so a chatty interpreter cannot fill a pipe and stall
        pb.redirectOutput(treeFile.toFile());
        pb.redirectError(errFile.toFile());

        log.debug("Running {} on: {}", pythonExecutable, sourceFile);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new IOException("Could not start Python interpreter '" + pythonExecutable + "': " + e.getMessage(), e);
        }

        boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
        if (!finished) {
            process.destroyForcibly();
            throw new IOException("Python parser timed out after " + timeoutSeconds + " seconds");
        }

        if (process.exitValue() != 0) {
            String stderr = new String(Files.readAllBytes(errFile), StandardCharsets.UTF_8);
            log.warn("Python parser exited with code {}: {}", process.exitValue(), stderr);
            throw new IOException("Python parser exited with code " + process.exitValue() + ": " + stderr.strip());
        }
    }
}
