package com.pystructure.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structure of a function or method definition.
 *
 * <p>Signature data (kind, parameters, return type, decorators, docstring) is fixed at
 * construction. Local variables, nested functions and nested classes are accumulated while
 * the body is analyzed; their getters return the live collections.
 */
public final class FunctionInfo implements ScopeRecord {

    private final String name;
    private final Integer line;
    private final FunctionKind kind;
    private final boolean async;
    private final List<ParameterInfo> parameters;
    private final String returnType;
    private final List<String> decorators;
    private final String docstring;

    private String fullPath;
    private final List<VariableInfo> localVars = new ArrayList<>();
    private final Map<String, FunctionInfo> nestedFunctions = new LinkedHashMap<>();
    private final Map<String, ClassInfo> nestedClasses = new LinkedHashMap<>();

    public FunctionInfo(String name, Integer line, FunctionKind kind, boolean async,
                        List<ParameterInfo> parameters, String returnType,
                        List<String> decorators, String docstring) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.line = line;
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.async = async;
        this.parameters = parameters != null ? List.copyOf(parameters) : List.of();
        this.returnType = returnType;
        this.decorators = decorators != null ? List.copyOf(decorators) : List.of();
        this.docstring = docstring;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("line")
    public Integer getLine() {
        return line;
    }

    @JsonProperty("type")
    public FunctionKind getKind() {
        return kind;
    }

    @JsonProperty("is_async")
    public boolean isAsync() {
        return async;
    }

    @JsonProperty("params")
    public List<ParameterInfo> getParameters() {
        return parameters;
    }

    @JsonProperty("return_type")
    public String getReturnType() {
        return returnType;
    }

    @JsonProperty("decorators")
    public List<String> getDecorators() {
        return decorators;
    }

    @JsonProperty("docstring")
    public String getDocstring() {
        return docstring;
    }

    @Override
    @JsonProperty("full_path")
    public String getFullPath() {
        return fullPath;
    }

    @Override
    public void setFullPath(String fullPath) {
        this.fullPath = fullPath;
    }

    @JsonProperty("local_vars")
    public List<VariableInfo> getLocalVars() {
        return localVars;
    }

    @JsonProperty("nested_functions")
    public Map<String, FunctionInfo> getNestedFunctions() {
        return nestedFunctions;
    }

    @JsonProperty("nested_classes")
    public Map<String, ClassInfo> getNestedClasses() {
        return nestedClasses;
    }

    @Override
    public boolean hasDefinition(String candidate) {
        return nestedFunctions.containsKey(candidate) || nestedClasses.containsKey(candidate);
    }

    @Override
    public String toString() {
        return "FunctionInfo{" +
            "name='" + name + '\'' +
            ", kind=" + kind +
            ", fullPath='" + fullPath + '\'' +
            ", params=" + parameters.size() +
            '}';
    }
}
