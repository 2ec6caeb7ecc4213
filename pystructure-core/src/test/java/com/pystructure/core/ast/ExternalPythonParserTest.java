package com.pystructure.core.ast;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the parser against small shell scripts standing in for the interpreter.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class ExternalPythonParserTest {

    private static final String EMPTY_MODULE = "{\"_type\": \"Module\", \"body\": []}";

    @TempDir
    Path tempDir;

    @Test
    @Timeout(30)
    void parse_interpreterFloodsStderr_completesWithoutBlocking() throws IOException {
        Path interpreter = interpreter("""
            #!/bin/sh
            head -c 400000 /dev/zero | tr '\\0' 'w' >&2
            echo '%s'
            """.formatted(EMPTY_MODULE));

        PythonTree.Module module = new ExternalPythonParser(interpreter.toString(), 20)
            .parse(sourceFile());

        assertThat(module.body()).isEmpty();
    }

    @Test
    void parse_nonZeroExit_includesStderrInMessage() throws IOException {
        Path interpreter = interpreter("""
            #!/bin/sh
            echo 'ImportError: no module named ast' >&2
            exit 3
            """);

        ExternalPythonParser parser = new ExternalPythonParser(interpreter.toString(), 20);

        assertThatThrownBy(() -> parser.parse(sourceFile()))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("exited with code 3")
            .hasMessageContaining("ImportError: no module named ast");
    }

    @Test
    void parse_missingInterpreter_throwsIOException() {
        ExternalPythonParser parser = new ExternalPythonParser(tempDir.resolve("no-such-python").toString(), 20);

        assertThatThrownBy(() -> parser.parse(sourceFile()))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("Could not start Python interpreter");
    }

    @Test
    void constructor_nonPositiveTimeout_throwsIllegalArgumentException() {
        assertThatThrownBy(() -> new ExternalPythonParser("python3", 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private Path interpreter(String body) throws IOException {
        Path script = tempDir.resolve("fake-python.sh");
        Files.writeString(script, body);
        assertThat(script.toFile().setExecutable(true)).isTrue();
        return script;
    }

    private Path sourceFile() throws IOException {
        Path source = tempDir.resolve("app.py");
        if (!Files.exists(source)) {
            Files.writeString(source, "pass\n");
        }
        return source;
    }
}
