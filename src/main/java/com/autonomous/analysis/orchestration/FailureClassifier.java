package com.autonomous.analysis.orchestration;

import com.autonomous.analysis.exception.AggregationException;
import com.autonomous.analysis.exception.ConfigurationException;
import com.autonomous.analysis.exception.DependencyUnmetException;
import com.autonomous.analysis.exception.InferenceException;
import com.autonomous.analysis.model.ErrorClass;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

public class FailureClassifier {

    public ErrorClass classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof InferenceException inference) {
            return inference.isRetryable() ? ErrorClass.TRANSIENT_INFERENCE : ErrorClass.PERMANENT_INFERENCE;
        }
        if (cause instanceof DependencyUnmetException) {
            return ErrorClass.DEPENDENCY_UNMET;
        }
        if (cause instanceof AggregationException) {
            return ErrorClass.AGGREGATION;
        }
        if (cause instanceof ConfigurationException) {
            return ErrorClass.CONFIGURATION;
        }
        if (cause instanceof TimeoutException
            || cause instanceof IOException
            || cause instanceof UncheckedIOException
            || cause instanceof InterruptedException
            || cause instanceof CancellationException) {
            return ErrorClass.TRANSIENT_INFERENCE;
        }
        return ErrorClass.PERMANENT_INFERENCE;
    }

    public String describe(Throwable error) {
        Throwable cause = unwrap(error);
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }

    private Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
