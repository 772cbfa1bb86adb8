package com.autonomous.analysis.exception;

import lombok.Getter;

@Getter
public class DependencyUnmetException extends AnalysisException {

    private final String role;
    private final String prerequisite;

    public DependencyUnmetException(String role, String prerequisite, String prerequisiteState) {
        super(String.format("Role '%s' skipped: mandatory prerequisite '%s' ended %s",
            role, prerequisite, prerequisiteState));
        this.role = role;
        this.prerequisite = prerequisite;
    }
}
