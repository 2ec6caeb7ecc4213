package com.pystructure.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pystructure.PyStructureCLI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.awt.GraphicsEnvironment;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * End-to-end tests of {@code pystructure analyze} using pre-dumped trees.
 */
class AnalyzeCommandTest {

    private static final String SERVICE_TREE = """
        {"_type": "Module", "body": [
          {"_type": "Expr", "lineno": 1, "value": {"_type": "Constant", "value": "Order service.", "repr": "'Order service.'"}},
          {"_type": "Import", "lineno": 3, "names": [{"_type": "alias", "name": "logging", "asname": null}]},
          {"_type": "Assign", "lineno": 5, "targets": [{"_type": "Name", "id": "MAX_ITEMS"}],
           "value": {"_type": "Constant", "value": 50, "repr": "50"}},
          {"_type": "FunctionDef", "name": "main", "lineno": 7,
           "args": {"_type": "arguments", "posonlyargs": [], "args": [], "vararg": null, "kwonlyargs": [],
                    "kw_defaults": [], "kwarg": null, "defaults": []},
           "body": [{"_type": "Pass", "lineno": 8}], "decorator_list": [], "returns": null},
          {"_type": "If", "lineno": 10,
           "test": {"_type": "Compare", "left": {"_type": "Name", "id": "__name__"}, "ops": [{"_type": "Eq"}],
                    "comparators": [{"_type": "Constant", "value": "__main__", "repr": "'__main__'"}]},
           "body": [{"_type": "Expr", "lineno": 11, "value": {"_type": "Call",
                     "func": {"_type": "Name", "id": "main"}, "args": [], "keywords": []}}],
           "orelse": []}
        ]}
        """;

    private static final String SYNTAX_ERROR_TREE = """
        {"_type": "SyntaxError", "lineno": 2, "offset": 5, "msg": "invalid syntax", "text": "def (:\\n"}
        """;

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeAll
    static void forceHeadless() {
        System.setProperty("java.awt.headless", "true");
    }

    @BeforeEach
    void redirectStreams() {
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void analyze_validFile_printsReport() throws IOException {
        Path source = sourceFile("service.py");

        int exitCode = run("analyze", source.toString(), "--tree", tree(SERVICE_TREE).toString());

        assertThat(exitCode).isZero();
        JsonNode report = mapper.readTree(out());
        assertThat(report.get("filepath").asText()).isEqualTo(source.toAbsolutePath().toString());
        assertThat(report.has("analysis_error")).isFalse();
        assertThat(report.get("module_docstring").asText()).isEqualTo("Order service.");
        assertThat(report.get("imports").get(0).get("name").asText()).isEqualTo("logging");
        assertThat(report.get("constants").get(0).get("name").asText()).isEqualTo("MAX_ITEMS");
        assertThat(report.get("functions").get("main").get("type").asText()).isEqualTo("function");
        assertThat(report.get("has_main_block").asBoolean()).isTrue();
    }

    @Test
    void analyze_prettyOutputIsDefault() throws IOException {
        run("analyze", sourceFile("service.py").toString(), "--tree", tree(SERVICE_TREE).toString());

        assertThat(out()).startsWith("{\n  \"classes\": {},");
    }

    @Test
    void analyze_noPretty_printsSingleLine() throws IOException {
        run("analyze", sourceFile("service.py").toString(), "--tree", tree(SERVICE_TREE).toString(), "--no-pretty");

        assertThat(out().strip()).doesNotContain("\n").startsWith("{\"classes\":{}");
    }

    @Test
    void analyze_configCanTurnOffPrettyOutput() throws IOException {
        Path config = Files.writeString(tempDir.resolve("pystructure.yaml"), "output:\n  pretty: false\n");

        run("analyze", sourceFile("service.py").toString(), "--tree", tree(SERVICE_TREE).toString(),
            "-c", config.toString());

        assertThat(out().strip()).doesNotContain("\n");
    }

    @Test
    void analyze_missingFile_reportsErrorAndExits1() throws IOException {
        Path missing = tempDir.resolve("missing.py");

        int exitCode = run("analyze", missing.toString(), "--tree", tree(SERVICE_TREE).toString());

        assertThat(exitCode).isEqualTo(1);
        JsonNode report = mapper.readTree(out());
        assertThat(report.get("analysis_error").asText()).isEqualTo("Error: File not found at '" + missing + "'");
        assertThat(report.size()).isEqualTo(2);
    }

    @Test
    void analyze_syntaxError_reportsDiagnosisAndExits1() throws IOException {
        Path source = sourceFile("broken.py");

        int exitCode = run("analyze", source.toString(), "--tree", tree(SYNTAX_ERROR_TREE).toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(mapper.readTree(out()).get("analysis_error").asText())
            .startsWith("Syntax Error: Invalid Python syntax in '" + source + "' near line 2 column 5:")
            .endsWith("Context: def (:");
    }

    @Test
    void analyze_outputFile_writesReportAndKeepsStdoutEmpty() throws IOException {
        Path output = tempDir.resolve("reports").resolve("service.json");

        int exitCode = run("analyze", sourceFile("service.py").toString(), "--tree", tree(SERVICE_TREE).toString(),
            "-o", output.toString());

        assertThat(exitCode).isZero();
        assertThat(out()).isEmpty();
        assertThat(err())
            .contains("Analysis report written to '" + output.toAbsolutePath() + "'");
        assertThat(mapper.readTree(output.toFile()).get("functions").has("main")).isTrue();
    }

    @Test
    void analyze_outputPathIsDirectory_fallsBackToStdout() throws IOException {
        Path directory = Files.createDirectories(tempDir.resolve("reports"));

        int exitCode = run("analyze", sourceFile("service.py").toString(), "--tree", tree(SERVICE_TREE).toString(),
            "-o", directory.toString());

        assertThat(exitCode).isZero();
        assertThat(mapper.readTree(out()).get("functions").has("main")).isTrue();
        assertThat(err())
            .contains("Error: Could not write to output file")
            .contains("--- JSON Report (Fallback to stdout) ---")
            .contains("--- End JSON Report ---");
    }

    @Test
    void analyze_copyWithoutClipboard_warnsAndStillPrintsReport() throws IOException {
        assumeTrue(GraphicsEnvironment.isHeadless(), "AWT already initialized with a display");

        int exitCode = run("analyze", sourceFile("service.py").toString(), "--tree", tree(SERVICE_TREE).toString(),
            "--copy");

        assertThat(exitCode).isZero();
        assertThat(mapper.readTree(out()).get("has_main_block").asBoolean()).isTrue();
        assertThat(err()).contains("Warning: Could not copy report to clipboard:");
    }

    @Test
    void noSubcommand_printsUsageHintToStderr() {
        int exitCode = PyStructureCLI.commandLine().execute();

        assertThat(exitCode).isZero();
        assertThat(out()).isEmpty();
        assertThat(err()).contains("pystructure --help");
    }

    private int run(String... args) {
        String[] withConfig = new String[args.length + 2];
        System.arraycopy(args, 0, withConfig, 0, args.length);
        withConfig[args.length] = "-c";
        withConfig[args.length + 1] = tempDir.resolve("absent.yaml").toString();
        boolean hasConfig = false;
        for (String arg : args) {
            hasConfig |= "-c".equals(arg);
        }
        return PyStructureCLI.commandLine().execute(hasConfig ? args : withConfig);
    }

    private String out() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return stderr.toString(StandardCharsets.UTF_8);
    }

    private Path sourceFile(String name) throws IOException {
        return Files.writeString(tempDir.resolve(name), "# source is read through the dumped tree\n");
    }

    private Path tree(String json) throws IOException {
        return Files.writeString(tempDir.resolve("tree.json"), json);
    }
}
