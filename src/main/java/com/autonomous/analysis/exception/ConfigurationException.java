package com.autonomous.analysis.exception;

public class ConfigurationException extends AnalysisException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
