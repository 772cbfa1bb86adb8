package com.autonomous.analysis.exception;

public class TransientInferenceException extends InferenceException {

    public TransientInferenceException(String message) {
        super(message);
    }

    public TransientInferenceException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
