package com.autonomous.analysis.orchestration;

import com.autonomous.analysis.model.ErrorClass;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void shouldDoubleDelayPerAttemptUpToMax() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofSeconds(1), Duration.ofSeconds(5), false);

        assertEquals(Duration.ofSeconds(1), policy.backoff(1));
        assertEquals(Duration.ofSeconds(2), policy.backoff(2));
        assertEquals(Duration.ofSeconds(4), policy.backoff(3));
        assertEquals(Duration.ofSeconds(5), policy.backoff(4));
        assertEquals(Duration.ofSeconds(5), policy.backoff(40));
    }

    @Test
    void shouldKeepJitterWithinTwentyPercent() {
        RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(1000), Duration.ofSeconds(30), true);

        for (int i = 0; i < 100; i++) {
            long delay = policy.backoff(2).toMillis();
            assertTrue(delay >= 2000 && delay <= 2400, "delay out of range: " + delay);
        }
    }

    @Test
    void shouldRetryOnlyTransientFailuresWithinBudget() {
        RetryPolicy policy = new RetryPolicy(2, Duration.ZERO, Duration.ZERO, false);

        assertTrue(policy.shouldRetry(ErrorClass.TRANSIENT_INFERENCE, 1));
        assertTrue(policy.shouldRetry(ErrorClass.TRANSIENT_INFERENCE, 2));
        assertFalse(policy.shouldRetry(ErrorClass.TRANSIENT_INFERENCE, 3));
        assertFalse(policy.shouldRetry(ErrorClass.PERMANENT_INFERENCE, 1));
        assertEquals(3, policy.maxAttempts());
    }
}
