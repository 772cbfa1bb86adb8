package com.autonomous.analysis.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class RoleDefinition {
    private String role;
    private String displayName;
    private String description;
    private String systemPrompt;
    private String promptTemplate;

    // Graph
    private List<String> prerequisites = new ArrayList<>();
    private List<String> optionalPrerequisites = new ArrayList<>();

    // Inputs and outputs
    private List<String> dataFiles = new ArrayList<>();
    private String summaryField = "summary";

    // Inference overrides, null falls back to the configured defaults
    private Double temperature;
    private Integer maxTokens;
    private String model;

    private String promptAssembler = "template";
    // Declaration order across role files, ties broken by role name
    private int order = Integer.MAX_VALUE;
    private boolean synthesis = false;

    public String getDisplayName() {
        return displayName != null ? displayName : role;
    }

    // An empty YAML key binds null
    public List<String> getPrerequisites() {
        return prerequisites != null ? prerequisites : List.of();
    }

    public List<String> getOptionalPrerequisites() {
        return optionalPrerequisites != null ? optionalPrerequisites : List.of();
    }

    public List<String> getDataFiles() {
        return dataFiles != null ? dataFiles : List.of();
    }
}
