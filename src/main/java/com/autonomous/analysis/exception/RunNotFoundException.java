package com.autonomous.analysis.exception;

public class RunNotFoundException extends AnalysisException {

    public RunNotFoundException(String runId) {
        super("Analysis run not found: " + runId);
    }
}
