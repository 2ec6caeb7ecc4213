package com.pystructure.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root record of an analyzed module.
 *
 * <p>All collections are live accumulators filled during one analysis run. When the
 * analysis failed part-way, {@link #getAnalysisError()} describes the failure and the
 * collections hold whatever was gathered before it.
 *
 * <p><b>Example (JSON view):</b>
 * <pre>{@code
 * {
 *   "imports": [{"name": "os", "line": 1}],
 *   "from_imports": {"typing": [{"name": "List", "line": 2}]},
 *   "constants": [{"name": "MAX_SIZE", "line": 4}],
 *   "functions": {"main": {...}},
 *   "classes": {"Service": {...}},
 *   "has_main_block": true
 * }
 * }</pre>
 */
public final class ModuleStructure implements ScopeRecord {

    private final List<ImportInfo> imports = new ArrayList<>();
    private final Map<String, List<ImportInfo>> fromImports = new LinkedHashMap<>();
    private final List<VariableInfo> constants = new ArrayList<>();
    private final List<VariableInfo> globalVars = new ArrayList<>();
    private final Map<String, FunctionInfo> functions = new LinkedHashMap<>();
    private final Map<String, ClassInfo> classes = new LinkedHashMap<>();

    private boolean hasMainBlock;
    private String moduleDocstring;
    private String analysisError;
    private String fullPath = "";

    @JsonProperty("imports")
    public List<ImportInfo> getImports() {
        return imports;
    }

    /**
     * Returns the {@code from ... import} names grouped by source module; relative modules
     * keep their leading dots (e.g., "..utils").
     *
     * @return module name to imported names
     */
    @JsonProperty("from_imports")
    public Map<String, List<ImportInfo>> getFromImports() {
        return fromImports;
    }

    @JsonProperty("constants")
    public List<VariableInfo> getConstants() {
        return constants;
    }

    @JsonProperty("global_vars")
    public List<VariableInfo> getGlobalVars() {
        return globalVars;
    }

    @JsonProperty("functions")
    public Map<String, FunctionInfo> getFunctions() {
        return functions;
    }

    @JsonProperty("classes")
    public Map<String, ClassInfo> getClasses() {
        return classes;
    }

    @JsonProperty("has_main_block")
    public boolean hasMainBlock() {
        return hasMainBlock;
    }

    /**
     * Records that a {@code if __name__ == "__main__":} guard was seen. Never cleared.
     */
    public void markMainBlock() {
        this.hasMainBlock = true;
    }

    @JsonProperty("module_docstring")
    public String getModuleDocstring() {
        return moduleDocstring;
    }

    public void setModuleDocstring(String moduleDocstring) {
        this.moduleDocstring = moduleDocstring;
    }

    @JsonProperty("analysis_error")
    public String getAnalysisError() {
        return analysisError;
    }

    public void setAnalysisError(String analysisError) {
        this.analysisError = analysisError;
    }

    @Override
    @JsonIgnore
    public String getFullPath() {
        return fullPath;
    }

    @Override
    public void setFullPath(String fullPath) {
        this.fullPath = fullPath;
    }

    @Override
    public boolean hasDefinition(String candidate) {
        return functions.containsKey(candidate) || classes.containsKey(candidate);
    }
}
