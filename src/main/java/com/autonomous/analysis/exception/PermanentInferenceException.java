package com.autonomous.analysis.exception;

public class PermanentInferenceException extends InferenceException {

    public PermanentInferenceException(String message) {
        super(message);
    }

    public PermanentInferenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
