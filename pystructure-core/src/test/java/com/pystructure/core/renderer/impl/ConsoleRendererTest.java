package com.pystructure.core.renderer.impl;

import com.pystructure.core.renderer.GeneratedFile;
import com.pystructure.core.renderer.GeneratedOutput;
import com.pystructure.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConsoleRendererTest {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private ConsoleRenderer renderer;

    @BeforeEach
    void setUp() {
        renderer = new ConsoleRenderer(
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void render_printsContentOnlyToStdout() {
        renderer.render(GeneratedOutput.of(new GeneratedFile("app.json", "{\"a\":1}", GeneratedFile.JSON)),
            RenderContext.of(Map.of()));

        assertThat(out.toString(StandardCharsets.UTF_8)).isEqualTo("{\"a\":1}" + System.lineSeparator());
        assertThat(err.size()).isZero();
    }

    @Test
    void render_stderrSetting_switchesStream() {
        renderer.render(GeneratedOutput.of(new GeneratedFile("app.json", "{}", GeneratedFile.JSON)),
            RenderContext.of(Map.of(ConsoleRenderer.STREAM_SETTING, ConsoleRenderer.STDERR)));

        assertThat(out.size()).isZero();
        assertThat(err.toString(StandardCharsets.UTF_8)).contains("{}");
    }

    @Test
    void getId_isConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }
}
