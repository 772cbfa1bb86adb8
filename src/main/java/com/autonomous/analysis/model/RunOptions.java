package com.autonomous.analysis.model;

import com.autonomous.analysis.exception.ConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder(toBuilder = true)
public class RunOptions {
    @Builder.Default
    int maxConcurrent = 3;
    @Builder.Default
    int maxRetries = 2;
    @Builder.Default
    Duration taskTimeout = Duration.ofSeconds(120);
    @Builder.Default
    Duration baseDelay = Duration.ofSeconds(1);
    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(30);
    @Builder.Default
    boolean jitter = true;
    @Builder.Default
    boolean enableCharts = true;

    public static RunOptions defaults() {
        return RunOptions.builder().build();
    }

    public RunOptions validate() {
        if (maxConcurrent < 1) {
            throw new ConfigurationException("maxConcurrent must be >= 1, was " + maxConcurrent);
        }
        if (maxRetries < 0) {
            throw new ConfigurationException("maxRetries must be >= 0, was " + maxRetries);
        }
        if (taskTimeout == null || taskTimeout.isZero() || taskTimeout.isNegative()) {
            throw new ConfigurationException("taskTimeout must be positive, was " + taskTimeout);
        }
        if (baseDelay == null || baseDelay.isNegative() || maxDelay == null || maxDelay.isNegative()) {
            throw new ConfigurationException("retry delays must not be negative");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new ConfigurationException("maxDelay (" + maxDelay + ") is shorter than baseDelay (" + baseDelay + ")");
        }
        return this;
    }
}
