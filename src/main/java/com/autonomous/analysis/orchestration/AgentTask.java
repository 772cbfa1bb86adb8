package com.autonomous.analysis.orchestration;

import com.autonomous.analysis.model.FailureRecord;
import com.autonomous.analysis.model.RoleStatus;
import com.autonomous.analysis.model.TaskState;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One role's unit of work within a run. All mutators are called with the owning run's lock held.
 */
@Getter
public class AgentTask {

    private static final Map<TaskState, Set<TaskState>> TRANSITIONS = Map.of(
        TaskState.WAITING, EnumSet.of(TaskState.READY, TaskState.SKIPPED),
        TaskState.READY, EnumSet.of(TaskState.RUNNING, TaskState.SKIPPED),
        TaskState.RUNNING, EnumSet.of(TaskState.SUCCEEDED, TaskState.FAILED, TaskState.READY),
        TaskState.SUCCEEDED, EnumSet.noneOf(TaskState.class),
        TaskState.FAILED, EnumSet.noneOf(TaskState.class),
        TaskState.SKIPPED, EnumSet.noneOf(TaskState.class)
    );

    private final String role;
    private final List<Prerequisite> prerequisites;
    private TaskState state = TaskState.WAITING;
    private int attempts;
    // System.nanoTime() deadline, so a wall clock step cannot hold back a retry
    @Getter(AccessLevel.NONE)
    private long notBeforeNanos;
    private FailureRecord lastFailure;
    @Getter(AccessLevel.NONE)
    private final List<FailureRecord> failures = new ArrayList<>();

    public AgentTask(String role, List<Prerequisite> prerequisites) {
        this.role = role;
        this.prerequisites = List.copyOf(prerequisites);
    }

    void markReady() {
        markReady(Duration.ZERO);
    }

    private void markReady(Duration delay) {
        transition(TaskState.READY);
        this.notBeforeNanos = System.nanoTime() + delay.toNanos();
    }

    int markRunning() {
        transition(TaskState.RUNNING);
        return ++attempts;
    }

    void markSucceeded() {
        transition(TaskState.SUCCEEDED);
    }

    void markFailed(FailureRecord failure) {
        transition(TaskState.FAILED);
        recordFailure(failure);
    }

    void markSkipped(FailureRecord reason) {
        transition(TaskState.SKIPPED);
        recordFailure(reason);
    }

    void scheduleRetry(FailureRecord failure, Duration delay) {
        recordFailure(failure);
        markReady(delay);
    }

    /**
     * @param nowNanos a {@link System#nanoTime()} reading
     */
    boolean isLaunchable(long nowNanos) {
        return state == TaskState.READY && nowNanos - notBeforeNanos >= 0;
    }

    public List<FailureRecord> getFailures() {
        return List.copyOf(failures);
    }

    public RoleStatus toStatus() {
        return RoleStatus.builder()
            .role(role)
            .state(state)
            .attempts(attempts)
            .lastErrorClass(lastFailure != null ? lastFailure.getErrorClass() : null)
            .lastError(lastFailure != null ? lastFailure.getMessage() : null)
            .build();
    }

    private void recordFailure(FailureRecord failure) {
        failures.add(failure);
        lastFailure = failure;
    }

    private void transition(TaskState next) {
        if (!TRANSITIONS.get(state).contains(next)) {
            throw new IllegalStateException(
                String.format("Illegal transition for role '%s': %s -> %s", role, state, next));
        }
        state = next;
    }
}
