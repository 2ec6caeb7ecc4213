package com.pystructure.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.pystructure.core.ast.ExternalPythonParser;
import com.pystructure.core.ast.JsonTreeParser;
import com.pystructure.core.ast.PythonTreeParser;
import com.pystructure.core.config.AnalyzerConfig;
import com.pystructure.core.config.ConfigLoader;
import com.pystructure.core.renderer.GeneratedFile;
import com.pystructure.core.renderer.GeneratedOutput;
import com.pystructure.core.renderer.OutputRenderer;
import com.pystructure.core.renderer.RenderContext;
import com.pystructure.core.renderer.impl.ConsoleRenderer;
import com.pystructure.core.report.JsonReportWriter;
import com.pystructure.core.report.ReportGenerator;
import com.pystructure.core.service.FileAnalysis;
import com.pystructure.core.service.PythonFileAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to analyze one Python file and emit its structure as JSON.
 *
 * <p>Pipeline:
 * <ol>
 *   <li>Load configuration ({@code pystructure.yaml}, optional)</li>
 *   <li>Parse the file (CPython via the configured interpreter, or a pre-dumped tree)</li>
 *   <li>Analyze the tree and build the report</li>
 *   <li>Render the JSON to stdout or a file, and optionally to the clipboard</li>
 * </ol>
 *
 * <p>Standard output carries only the JSON report; diagnostics go to standard error. The
 * exit code is 1 when the report carries an {@code analysis_error}, 0 otherwise.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * pystructure analyze my_module.py
 * pystructure analyze script.py -o report.json
 * pystructure analyze script.py --copy --no-pretty
 * pystructure analyze script.py --tree script.ast.json
 * }</pre>
 */
@Command(
    name = "analyze",
    description = "Analyze the structure of a Python file and output results as JSON",
    mixinStandardHelpOptions = true
)
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeCommand.class);

    @Parameters(
        index = "0",
        paramLabel = "FILE",
        description = "Path to the Python file (.py) to analyze"
    )
    private Path filePath;

    @Option(
        names = {"-o", "--output"},
        paramLabel = "FILE",
        description = "Write the JSON report to this file instead of stdout"
    )
    private Path outputFile;

    @Option(
        names = {"--copy"},
        description = "Copy the JSON report to the system clipboard"
    )
    private boolean copy;

    @Option(
        names = {"--pretty"},
        negatable = true,
        description = "Pretty-print the JSON report (default: true, or output.pretty from the config)"
    )
    private Boolean pretty;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: pystructure.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"--tree"},
        paramLabel = "JSON",
        description = "Read a syntax tree dumped beforehand instead of running Python"
    )
    private Path treeDocument;

    @Override
    public Integer call() {
        try {
            AnalyzerConfig config = ConfigLoader.load(configPath);
            boolean prettyOutput = pretty != null ? pretty : config.output().pretty();

            FileAnalysis analysis = new PythonFileAnalyzer(createParser(config)).analyze(filePath);

            ReportGenerator generator = new ReportGenerator();
            Map<String, Object> report = generator.generate(analysis);

            String json;
            try {
                json = new JsonReportWriter(prettyOutput).write(report);
            } catch (JsonProcessingException e) {
                log.error("Failed to serialize report for {}", filePath, e);
                return emitMinimalReport(generator.generateMinimal(analysis,
                    "Fatal Error: Could not serialize analysis results to JSON: " + e.getOriginalMessage()));
            }

            Map<String, OutputRenderer> renderers = discoverRenderers();
            GeneratedFile document = new GeneratedFile(reportFileName(), json, GeneratedFile.JSON);

            if (outputFile != null) {
                writeToFile(renderers, document);
            } else {
                renderers.get("console").render(GeneratedOutput.of(document), RenderContext.of(Map.of()));
            }

            if (copy) {
                copyToClipboard(renderers, document);
            }

            return report.containsKey(ReportGenerator.ANALYSIS_ERROR) ? 1 : 0;

        } catch (RuntimeException e) {
            log.error("Analysis failed", e);
            System.err.println("Analysis failed: " + e.getMessage());
            return 1;
        }
    }

    private PythonTreeParser createParser(AnalyzerConfig config) {
        if (treeDocument != null) {
            log.debug("Using pre-dumped tree: {}", treeDocument);
            return new JsonTreeParser(treeDocument);
        }
        return new ExternalPythonParser(config.parser().pythonExecutable(), config.parser().timeoutSeconds());
    }

    /**
     * Discovers all available renderers via SPI, keyed by id.
     */
    private Map<String, OutputRenderer> discoverRenderers() {
        Map<String, OutputRenderer> renderers = new LinkedHashMap<>();
        ServiceLoader.load(OutputRenderer.class).forEach(r -> renderers.put(r.getId(), r));
        renderers.putIfAbsent("console", new ConsoleRenderer());
        log.debug("Discovered renderers: {}", renderers.keySet());
        return renderers;
    }

    private void writeToFile(Map<String, OutputRenderer> renderers, GeneratedFile document) {
        Path target = outputFile.toAbsolutePath();
        Path directory = target.getParent() != null ? target.getParent() : Paths.get(".");
        OutputRenderer fileRenderer = renderers.get("filesystem");

        try {
            if (fileRenderer == null) {
                throw new IllegalStateException("No filesystem renderer available");
            }
            fileRenderer.render(GeneratedOutput.of(document), new RenderContext(directory.toString(), Map.of()));
            System.err.println("Analysis report written to '" + target + "'");
        } catch (IllegalStateException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println("--- JSON Report (Fallback to stdout) ---");
            renderers.get("console").render(GeneratedOutput.of(document), RenderContext.of(Map.of()));
            System.err.println("--- End JSON Report ---");
        }
    }

    private void copyToClipboard(Map<String, OutputRenderer> renderers, GeneratedFile document) {
        OutputRenderer clipboard = renderers.get("clipboard");
        if (clipboard == null) {
            System.err.println("Warning: --copy specified, but no clipboard renderer is available.");
            return;
        }
        try {
            clipboard.render(GeneratedOutput.of(document), RenderContext.of(Map.of()));
            System.err.println("JSON report copied to clipboard.");
        } catch (IllegalStateException e) {
            log.debug("Clipboard copy failed", e);
            System.err.println("Warning: Could not copy report to clipboard: " + e.getMessage());
        }
    }

    private int emitMinimalReport(Map<String, Object> minimal) {
        try {
            String json = new JsonReportWriter(true).write(minimal);
            new ConsoleRenderer().render(
                GeneratedOutput.of(new GeneratedFile(reportFileName(), json, GeneratedFile.JSON)),
                RenderContext.of(Map.of(ConsoleRenderer.STREAM_SETTING, ConsoleRenderer.STDERR)));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize minimal report", e);
            System.err.println(minimal);
        }
        return 1;
    }

    private String reportFileName() {
        return outputFile != null && outputFile.getFileName() != null
            ? outputFile.getFileName().toString()
            : "report.json";
    }
}
