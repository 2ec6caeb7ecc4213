package com.pystructure.core.renderer.impl;

import com.pystructure.core.renderer.GeneratedFile;
import com.pystructure.core.renderer.GeneratedOutput;
import com.pystructure.core.renderer.OutputRenderer;
import com.pystructure.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.GraphicsEnvironment;
import java.awt.HeadlessException;
import java.awt.Toolkit;
import java.awt.datatransfer.StringSelection;
import java.util.stream.Collectors;

/**
 * Renderer that places report content on the system clipboard.
 *
 * <p>Multiple files are joined with a line break. Fails with
 * {@link IllegalStateException} in headless environments or when the clipboard is
 * unavailable.
 */
public class ClipboardRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ClipboardRenderer.class);

    @Override
    public String getId() {
        return "clipboard";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        if (GraphicsEnvironment.isHeadless()) {
            throw new IllegalStateException("No system clipboard available in a headless environment");
        }

        String content = output.files().stream()
            .map(GeneratedFile::content)
            .collect(Collectors.joining("\n"));

        try {
            Toolkit.getDefaultToolkit().getSystemClipboard().setContents(new StringSelection(content), null);
        } catch (IllegalStateException | HeadlessException e) {
            throw new IllegalStateException("Could not copy report to clipboard: " + e.getMessage(), e);
        }
        logger.debug("Copied {} characters to clipboard", content.length());
    }
}
