package com.pystructure.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structure of a class definition.
 *
 * <p>Bases, decorators and docstring are fixed at construction; methods, class variables,
 * instance variables and nested classes are accumulated while the body is analyzed.
 * Class and instance variables are unique by name: the first binding wins.
 */
public final class ClassInfo implements ScopeRecord {

    private final String name;
    private final Integer line;
    private final List<String> baseClasses;
    private final List<String> decorators;
    private final String docstring;

    private String fullPath;
    private final Map<String, FunctionInfo> methods = new LinkedHashMap<>();
    private final List<VariableInfo> classVars = new ArrayList<>();
    private final List<VariableInfo> instanceVars = new ArrayList<>();
    private final Map<String, ClassInfo> nestedClasses = new LinkedHashMap<>();

    public ClassInfo(String name, Integer line, List<String> baseClasses,
                     List<String> decorators, String docstring) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.line = line;
        this.baseClasses = baseClasses != null ? List.copyOf(baseClasses) : List.of();
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

    @JsonProperty("base_classes")
    public List<String> getBaseClasses() {
        return baseClasses;
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

    @JsonProperty("methods")
    public Map<String, FunctionInfo> getMethods() {
        return methods;
    }

    @JsonProperty("class_vars")
    public List<VariableInfo> getClassVars() {
        return classVars;
    }

    @JsonProperty("instance_vars")
    public List<VariableInfo> getInstanceVars() {
        return instanceVars;
    }

    @JsonProperty("nested_classes")
    public Map<String, ClassInfo> getNestedClasses() {
        return nestedClasses;
    }

    /**
     * Adds a class variable unless one with the same name is already recorded.
     *
     * @param variable class variable
     * @return true if added
     */
    public boolean addClassVar(VariableInfo variable) {
        return addUnique(classVars, variable);
    }

    /**
     * Adds an instance variable unless one with the same name is already recorded.
     *
     * @param variable instance variable
     * @return true if added
     */
    public boolean addInstanceVar(VariableInfo variable) {
        return addUnique(instanceVars, variable);
    }

    @Override
    public boolean hasDefinition(String candidate) {
        return methods.containsKey(candidate) || nestedClasses.containsKey(candidate);
    }

    private static boolean addUnique(List<VariableInfo> variables, VariableInfo variable) {
        boolean exists = variables.stream().anyMatch(v -> v.name().equals(variable.name()));
        if (exists) {
            return false;
        }
        variables.add(variable);
        return true;
    }

    @Override
    public String toString() {
        return "ClassInfo{" +
            "name='" + name + '\'' +
            ", baseClasses=" + baseClasses +
            ", methods=" + methods.keySet() +
            '}';
    }
}
