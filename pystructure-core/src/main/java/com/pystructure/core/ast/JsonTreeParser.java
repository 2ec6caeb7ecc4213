package com.pystructure.core.ast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * {@link PythonTreeParser} that reads a tree dumped beforehand by {@code ast_dump.py}.
 *
 * <p>The source file itself is not read; the tree document stands in for it. Useful when
 * no interpreter is available where the analysis runs.
 */
public class JsonTreeParser implements PythonTreeParser {

    private static final Logger log = LoggerFactory.getLogger(JsonTreeParser.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final Path treeDocument;
    private final PythonTreeJsonReader reader = new PythonTreeJsonReader();

    /**
     * @param treeDocument path to the JSON tree document
     */
    public JsonTreeParser(Path treeDocument) {
        this.treeDocument = Objects.requireNonNull(treeDocument, "treeDocument must not be null");
    }

    @Override
    public String getName() {
        return "json-tree";
    }

    @Override
    public PythonTree.Module parse(Path sourceFile) throws IOException {
        if (!Files.isRegularFile(treeDocument)) {
            throw new IOException("Tree document not found: " + treeDocument);
        }
        log.debug("Reading tree for {} from: {}", sourceFile, treeDocument);
        JsonNode document = OBJECT_MAPPER.readTree(treeDocument.toFile());
        return reader.readDocument(document);
    }
}
