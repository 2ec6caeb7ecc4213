package com.pystructure.core.report;

import com.pystructure.core.analyzer.StructureAnalyzer;
import com.pystructure.core.model.ModuleStructure;
import com.pystructure.core.service.FileAnalysis;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static com.pystructure.core.ast.TreeBuilder.assign;
import static com.pystructure.core.ast.TreeBuilder.attr;
import static com.pystructure.core.ast.TreeBuilder.classDef;
import static com.pystructure.core.ast.TreeBuilder.def;
import static com.pystructure.core.ast.TreeBuilder.module;
import static com.pystructure.core.ast.TreeBuilder.name;
import static com.pystructure.core.ast.TreeBuilder.num;
import static com.pystructure.core.ast.TreeBuilder.params;
import static com.pystructure.core.ast.TreeBuilder.str;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ReportGenerator}.
 */
class ReportGeneratorTest {

    private final ReportGenerator generator = new ReportGenerator();
    private final Path file = Path.of("src", "app.py");

    @Test
    void generate_successfulAnalysis_startsWithAbsolutePathAndHasNoError() {
        ModuleStructure structure = StructureAnalyzer.analyze(module(assign("VERSION", str("2.0"), 1)));

        Map<String, Object> report = generator.generate(FileAnalysis.of(file, structure));

        assertThat(report.keySet().iterator().next()).isEqualTo(ReportGenerator.FILEPATH);
        assertThat(report.get(ReportGenerator.FILEPATH)).isEqualTo(file.toAbsolutePath().toString());
        assertThat(report).doesNotContainKey(ReportGenerator.ANALYSIS_ERROR);
        assertThat(report).containsKeys("imports", "from_imports", "constants", "global_vars",
            "functions", "classes", "has_main_block");
    }

    @Test
    void generate_dropsAbsentFields() {
        ModuleStructure structure = StructureAnalyzer.analyze(module(assign("VERSION", str("2.0"), 1)));

        Map<String, Object> report = generator.generate(FileAnalysis.of(file, structure));

        assertThat(report).doesNotContainKey("module_docstring");
        assertThat(report.get("constants")).isEqualTo(List.of(Map.of("name", "VERSION", "line", 1)));
    }

    @Test
    void generate_nestedRecordsUseReportKeys() {
        ModuleStructure structure = StructureAnalyzer.analyze(module(
            classDef("Counter", 1,
                def("__init__", 2, params("self"), assign(attr("self", "value"), num(0), 3)))));

        Map<String, Object> report = generator.generate(FileAnalysis.of(file, structure));

        Map<?, ?> counter = (Map<?, ?>) ((Map<?, ?>) report.get("classes")).get("Counter");
        assertThat(counter.get("full_path")).isEqualTo("Counter");
        assertThat(counter.get("instance_vars")).isEqualTo(List.of(Map.of("name", "value", "line", 3)));

        Map<?, ?> init = (Map<?, ?>) ((Map<?, ?>) counter.get("methods")).get("__init__");
        assertThat(init.get("type")).isEqualTo("instance_method");
        assertThat(init.get("is_async")).isEqualTo(false);
        assertThat(init.get("full_path")).isEqualTo("Counter.__init__");
        assertThat(init.get("params")).isEqualTo(List.of(Map.of("name", "self", "kind", "POSITIONAL_OR_KEYWORD")));
    }

    @Test
    void generate_failedInput_hasOnlyPathAndError() {
        Map<String, Object> report = generator.generate(FileAnalysis.failed(file, "Error: File not found at 'src/app.py'"));

        assertThat(report).containsOnlyKeys(ReportGenerator.FILEPATH, ReportGenerator.ANALYSIS_ERROR);
        assertThat(report.get(ReportGenerator.ANALYSIS_ERROR)).isEqualTo("Error: File not found at 'src/app.py'");
    }

    @Test
    void generate_partialRecord_keepsErrorAndStructure() {
        ModuleStructure structure = StructureAnalyzer.analyze(module(assign("value", name("x"), 1)));
        structure.setAnalysisError("Unexpected Analysis Error: IllegalStateException: boom");

        Map<String, Object> report = generator.generate(FileAnalysis.of(file, structure));

        assertThat(report.get(ReportGenerator.ANALYSIS_ERROR))
            .isEqualTo("Unexpected Analysis Error: IllegalStateException: boom");
        assertThat(report).containsKey("global_vars");
    }

    @Test
    void generateMinimal_usesFallbackWhenAnalysisHasNoError() {
        ModuleStructure structure = new ModuleStructure();

        Map<String, Object> report = generator.generateMinimal(FileAnalysis.of(file, structure), "Encoding failed");

        assertThat(report).containsOnlyKeys(ReportGenerator.FILEPATH, ReportGenerator.ANALYSIS_ERROR);
        assertThat(report.get(ReportGenerator.ANALYSIS_ERROR)).isEqualTo("Encoding failed");
    }
}
