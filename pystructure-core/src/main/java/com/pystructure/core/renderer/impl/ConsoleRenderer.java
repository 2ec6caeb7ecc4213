package com.pystructure.core.renderer.impl;

import com.pystructure.core.renderer.GeneratedFile;
import com.pystructure.core.renderer.GeneratedOutput;
import com.pystructure.core.renderer.OutputRenderer;
import com.pystructure.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Renderer that prints report content, unadorned, to a console stream.
 *
 * <p>Nothing but the content is printed, so standard output stays valid JSON.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.stream} - "stdout" (default) or "stderr"</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    public static final String STREAM_SETTING = "console.stream";
    public static final String STDERR = "stderr";

    private final PrintStream out;
    private final PrintStream err;

    public ConsoleRenderer() {
        this(System.out, System.err);
    }

    /**
     * @param out standard output stream
     * @param err standard error stream
     */
    public ConsoleRenderer(PrintStream out, PrintStream err) {
        this.out = Objects.requireNonNull(out, "out must not be null");
        this.err = Objects.requireNonNull(err, "err must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean toStderr = STDERR.equalsIgnoreCase(context.getSettingOrDefault(STREAM_SETTING, "stdout"));
        PrintStream stream = toStderr ? err : out;

        logger.debug("Rendering {} file(s) to {}", output.files().size(), toStderr ? "stderr" : "stdout");
        for (GeneratedFile file : output.files()) {
            stream.println(file.content());
        }
        stream.flush();
    }
}
