package com.autonomous.analysis.exception;

import lombok.Getter;

@Getter
public class AggregationException extends AnalysisException {

    private final int attempts;

    public AggregationException(String message, int attempts) {
        super(message);
        this.attempts = attempts;
    }

    public AggregationException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }
}
