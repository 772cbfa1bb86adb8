package com.autonomous.analysis.exception;

public abstract class InferenceException extends AnalysisException {

    protected InferenceException(String message) {
        super(message);
    }

    protected InferenceException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRetryable();
}
