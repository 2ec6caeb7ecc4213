package com.pystructure.core.renderer.impl;

import com.pystructure.core.renderer.GeneratedFile;
import com.pystructure.core.renderer.GeneratedOutput;
import com.pystructure.core.renderer.OutputRenderer;
import com.pystructure.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Renderer that writes report files to the filesystem as UTF-8.
 *
 * <p>Missing parent directories are created and existing files are overwritten.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * RenderContext context = new RenderContext("./reports", Map.of());
 * GeneratedOutput output = GeneratedOutput.of(
 *     new GeneratedFile("app.json", json, GeneratedFile.JSON));
 *
 * new FileSystemRenderer().render(output, context);
 * // Creates: ./reports/app.json
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = Paths.get(context.outputDirectory());
        logger.debug("Rendering {} file(s) to filesystem at: {}", output.files().size(), outputDir);

        for (GeneratedFile file : output.files()) {
            writeFile(outputDir, file);
        }
    }

    private void writeFile(Path outputDir, GeneratedFile file) {
        Path targetPath = outputDir.resolve(file.relativePath());

        try {
            Path parentDir = targetPath.getParent();
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }

            Files.writeString(targetPath, file.content(), StandardCharsets.UTF_8);
            logger.info("Wrote file: {} ({} bytes)", targetPath.toAbsolutePath(), file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Could not write to output file '" + targetPath + "': " + e.getMessage(), e);
        }
    }
}
