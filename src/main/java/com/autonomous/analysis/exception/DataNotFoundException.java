package com.autonomous.analysis.exception;

public class DataNotFoundException extends AnalysisException {

    public DataNotFoundException(String message) {
        super(message);
    }

    public DataNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
