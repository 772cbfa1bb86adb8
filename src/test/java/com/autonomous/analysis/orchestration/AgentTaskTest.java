package com.autonomous.analysis.orchestration;

import com.autonomous.analysis.model.ErrorClass;
import com.autonomous.analysis.model.FailureRecord;
import com.autonomous.analysis.model.RoleStatus;
import com.autonomous.analysis.model.TaskState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AgentTaskTest {

    private static FailureRecord failure(int attempt) {
        return FailureRecord.builder()
            .role("macro").attempt(attempt).errorClass(ErrorClass.TRANSIENT_INFERENCE).message("timeout").build();
    }

    @Test
    void shouldCountAttemptsAcrossRetries() {
        AgentTask task = new AgentTask("macro", List.of());
        task.markReady();

        assertEquals(1, task.markRunning());
        task.scheduleRetry(failure(1), Duration.ZERO);
        assertEquals(TaskState.READY, task.getState());
        assertEquals(2, task.markRunning());
        task.markSucceeded();

        RoleStatus status = task.toStatus();
        assertEquals(TaskState.SUCCEEDED, status.getState());
        assertEquals(2, status.getAttempts());
        assertEquals(ErrorClass.TRANSIENT_INFERENCE, status.getLastErrorClass());
        assertEquals(1, task.getFailures().size());
    }

    @Test
    void shouldHonourBackoffBeforeLaunch() {
        AgentTask task = new AgentTask("macro", List.of());
        task.markReady();
        task.markRunning();
        task.scheduleRetry(failure(1), Duration.ofSeconds(5));

        long now = System.nanoTime();
        assertFalse(task.isLaunchable(now));
        assertTrue(task.isLaunchable(now + Duration.ofSeconds(5).toNanos()));
    }

    @Test
    void shouldGateRetryOnMonotonicClock() {
        AgentTask task = new AgentTask("macro", List.of());
        task.markReady();
        task.markRunning();
        long before = System.nanoTime();
        task.scheduleRetry(failure(1), Duration.ofMillis(200));
        long after = System.nanoTime();

        // The gate follows System.nanoTime(), the same clock the retry timer waits on
        assertFalse(task.isLaunchable(before));
        assertTrue(task.isLaunchable(after + Duration.ofMillis(200).toNanos()));
    }

    @Test
    void shouldBeLaunchableAsSoonAsReady() {
        AgentTask task = new AgentTask("macro", List.of());
        task.markReady();

        assertTrue(task.isLaunchable(System.nanoTime()));
    }

    @Test
    void shouldRejectIllegalTransitions() {
        AgentTask task = new AgentTask("macro", List.of());

        assertThrows(IllegalStateException.class, task::markRunning);
        assertThrows(IllegalStateException.class, task::markSucceeded);

        task.markSkipped(failure(0));
        assertThrows(IllegalStateException.class, task::markReady);
        assertTrue(task.getState().isTerminal());
    }
}
