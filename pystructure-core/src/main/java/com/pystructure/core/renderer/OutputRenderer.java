package com.pystructure.core.renderer;

/**
 * Destination for generated reports.
 *
 * <p>Renderers write report files to stdout, the filesystem or the system clipboard.
 * They are discovered via Java Service Provider Interface (SPI) and selected by
 * {@link #getId()}.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class StderrRenderer implements OutputRenderer {
 *     @Override
 *     public String getId() {
 *         return "stderr";
 *     }
 *
 *     @Override
 *     public void render(GeneratedOutput output, RenderContext context) {
 *         output.files().forEach(file -> System.err.println(file.content()));
 *     }
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.pystructure.core.renderer.OutputRenderer}
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer (e.g., "console", "filesystem").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Renders the generated output to the target destination.
     *
     * <p>Implementations throw {@link IllegalStateException} when the destination is not
     * available or cannot be written; callers decide on a fallback.
     *
     * @param output the report files to render
     * @param context rendering context with destination and settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
