package com.autonomous.analysis.exception;

public class DuplicateWriteException extends AnalysisException {

    public DuplicateWriteException(String role) {
        super("A result for role '" + role + "' was already written in this run");
    }
}
