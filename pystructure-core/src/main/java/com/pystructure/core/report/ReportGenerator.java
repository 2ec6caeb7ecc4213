package com.pystructure.core.report;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pystructure.core.model.ModuleStructure;
import com.pystructure.core.service.FileAnalysis;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the report map for one analyzed file.
 *
 * <p>The report starts with {@code filepath} (absolute) and, when present,
 * {@code analysis_error}. A file that could not be read or parsed produces only those two
 * keys. Otherwise the module record follows, sorted by {@link ReportSorter} and stripped of
 * absent fields; a record left partial by an analysis failure is kept.
 */
public class ReportGenerator {

    public static final String FILEPATH = "filepath";
    public static final String ANALYSIS_ERROR = "analysis_error";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    /**
     * Generates the report.
     *
     * @param analysis analysis outcome
     * @return ordered report map
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> generate(FileAnalysis analysis) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put(FILEPATH, analysis.filePath().toAbsolutePath().toString());
        if (analysis.error() != null) {
            report.put(ANALYSIS_ERROR, analysis.error());
        }

        ModuleStructure structure = analysis.structure();
        if (structure == null) {
            return report;
        }

        Map<String, Object> record = MAPPER.convertValue(structure, MAP_TYPE);
        record.remove(ANALYSIS_ERROR);
        ReportSorter.sortScope(record);
        report.putAll((Map<String, Object>) ReportSorter.withoutNulls(record));
        return report;
    }

    /**
     * Generates the report reduced to {@code filepath} and {@code analysis_error}.
     *
     * @param analysis analysis outcome
     * @param fallbackError error used when the analysis carries none
     * @return minimal report map
     */
    public Map<String, Object> generateMinimal(FileAnalysis analysis, String fallbackError) {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put(FILEPATH, analysis.filePath().toAbsolutePath().toString());
        report.put(ANALYSIS_ERROR, analysis.error() != null ? analysis.error() : fallbackError);
        return report;
    }
}
