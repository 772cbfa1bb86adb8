package com.autonomous.analysis.orchestration;

import com.autonomous.analysis.model.ErrorClass;
import com.autonomous.analysis.model.RunOptions;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with an optional jitter of up to 20% of the delay, capped at {@code maxDelay}.
 */
public class RetryPolicy {

    private static final double JITTER_RATIO = 0.2;

    private final int maxRetries;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final boolean jitter;

    public RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay, boolean jitter) {
        this.maxRetries = maxRetries;
        this.baseDelayMs = baseDelay.toMillis();
        this.maxDelayMs = maxDelay.toMillis();
        this.jitter = jitter;
    }

    public static RetryPolicy from(RunOptions options) {
        return new RetryPolicy(options.getMaxRetries(), options.getBaseDelay(), options.getMaxDelay(), options.isJitter());
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    /**
     * @param attempt the 1-based attempt that just failed
     */
    public boolean shouldRetry(ErrorClass errorClass, int attempt) {
        return errorClass == ErrorClass.TRANSIENT_INFERENCE && attempt <= maxRetries;
    }

    /**
     * Delay before the attempt that follows {@code attempt}: {@code baseDelay * 2^(attempt - 1)}.
     */
    public Duration backoff(int attempt) {
        int exponent = Math.min(Math.max(attempt - 1, 0), 30);
        long delay = baseDelayMs << exponent;
        if (delay < 0 || delay > maxDelayMs) {
            delay = maxDelayMs;
        }
        if (jitter && delay > 0) {
            long bound = (long) (delay * JITTER_RATIO);
            if (bound > 0) {
                delay = Math.min(maxDelayMs, delay + ThreadLocalRandom.current().nextLong(bound + 1));
            }
        }
        return Duration.ofMillis(delay);
    }
}
