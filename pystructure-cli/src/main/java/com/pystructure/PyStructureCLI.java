package com.pystructure;

import ch.qos.logback.classic.Level;
import com.pystructure.cli.AnalyzeCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParseResult;

/**
 * Main CLI entry point for PyStructure.
 *
 * <p>PyStructure summarizes the structure of a Python source file as JSON: imports,
 * constants and variables, functions, classes, methods, parameters and nested scopes.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code analyze} - Analyze one {@code .py} file</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all log output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Print the structure of a module
 * pystructure analyze my_module.py
 *
 * # Write compact JSON to a file
 * pystructure analyze app/service.py -o reports/service.json --no-pretty
 *
 * # Debug logging
 * pystructure -v analyze script.py
 * }</pre>
 */
@Command(
    name = "pystructure",
    mixinStandardHelpOptions = true,
    version = "PyStructure 1.0.0-SNAPSHOT",
    description = "Structural summary of Python source files",
    subcommands = {
        AnalyzeCommand.class
    }
)
public class PyStructureCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PyStructureCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all log output except errors")
    private boolean quiet;

    @Override
    public void run() {
        System.err.println("PyStructure - Structural summary of Python source files");
        System.err.println("Use 'pystructure --help' to see available commands");
    }

    /**
     * Applies the logging options, then runs the most specific command that was given.
     *
     * @param parseResult parsed command line
     * @return exit code
     */
    int executionStrategy(ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with the logging-aware execution strategy.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        PyStructureCLI cli = new PyStructureCLI();
        return new CommandLine(cli).setExecutionStrategy(cli::executionStrategy);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
