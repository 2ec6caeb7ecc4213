package com.pystructure.core.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.util.Map;

/**
 * Encodes report maps as JSON.
 *
 * <p>Keys are sorted at every level and non-ASCII text is written as is. Pretty output
 * indents objects and arrays by two spaces, one entry per line.
 */
public class JsonReportWriter {

    private final ObjectWriter writer;

    /**
     * @param pretty whether to indent the output
     */
    public JsonReportWriter(boolean pretty) {
        ObjectMapper mapper = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.writer = pretty
            ? mapper.writer(new ReportPrettyPrinter())
            : mapper.writer();
    }

    /**
     * Serializes a report.
     *
     * @param report report map
     * @return JSON text
     * @throws JsonProcessingException if a value cannot be serialized
     */
    public String write(Map<String, Object> report) throws JsonProcessingException {
        return writer.writeValueAsString(report);
    }

    /**
     * Two-space indentation for objects and arrays, {@code ": "} between field and value.
     */
    static final class ReportPrettyPrinter extends DefaultPrettyPrinter {

        private static final DefaultIndenter INDENTER = new DefaultIndenter("  ", "\n");

        ReportPrettyPrinter() {
            indentObjectsWith(INDENTER);
            indentArraysWith(INDENTER);
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new ReportPrettyPrinter();
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        // Empty containers print as {} and [] with no inner space
        @Override
        public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
            if (!_objectIndenter.isInline()) {
                --_nesting;
            }
            if (nrOfEntries > 0) {
                _objectIndenter.writeIndentation(g, _nesting);
            }
            g.writeRaw('}');
        }

        @Override
        public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
            if (!_arrayIndenter.isInline()) {
                --_nesting;
            }
            if (nrOfValues > 0) {
                _arrayIndenter.writeIndentation(g, _nesting);
            }
            g.writeRaw(']');
        }
    }
}
