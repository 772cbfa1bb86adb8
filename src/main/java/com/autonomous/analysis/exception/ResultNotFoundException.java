package com.autonomous.analysis.exception;

public class ResultNotFoundException extends AnalysisException {

    public ResultNotFoundException(String role) {
        super("No result recorded for role '" + role + "'");
    }
}
