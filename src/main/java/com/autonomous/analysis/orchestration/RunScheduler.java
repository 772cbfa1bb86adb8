package com.autonomous.analysis.orchestration;

import com.autonomous.analysis.data.RawDataProvider;
import com.autonomous.analysis.exception.DependencyUnmetException;
import com.autonomous.analysis.model.AgentResult;
import com.autonomous.analysis.model.DataPayload;
import com.autonomous.analysis.model.ErrorClass;
import com.autonomous.analysis.model.FailureRecord;
import com.autonomous.analysis.model.TaskInput;
import com.autonomous.analysis.model.TaskState;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Drives every task of a run from {@code WAITING} to a terminal state.
 *
 * <p>Scheduling is event driven: a tick runs at start, after every attempt and when a retry
 * backoff expires. A tick promotes tasks whose prerequisites are terminal, skips those with a
 * failed mandatory prerequisite, and launches ready tasks while fewer than {@code maxConcurrent}
 * are running. Launch order prefers tasks with more pending dependents, then declaration order.</p>
 */
@Slf4j
public class RunScheduler {

    private final AnalysisRun run;
    private final AttemptRunner attemptRunner;
    private final RawDataProvider dataProvider;
    private final RetryPolicy retryPolicy;
    private final FailureClassifier classifier;
    private final ExecutorService workers;
    private final ScheduledExecutorService timer;

    public RunScheduler(AnalysisRun run, AttemptRunner attemptRunner, RawDataProvider dataProvider,
                        RetryPolicy retryPolicy, FailureClassifier classifier,
                        ExecutorService workers, ScheduledExecutorService timer) {
        this.run = run;
        this.attemptRunner = attemptRunner;
        this.dataProvider = dataProvider;
        this.retryPolicy = retryPolicy;
        this.classifier = classifier;
        this.workers = workers;
        this.timer = timer;
    }

    /**
     * Blocks until every task is terminal. Cancelling the run skips pending tasks and
     * interrupts the attempts in flight.
     */
    public void execute() {
        run.onCancel(() -> {
            tick();
            workers.shutdownNow();
        });
        tick();
        run.awaitAllTerminal();
    }

    void tick() {
        List<Launch> launches = run.withLock(() -> {
            List<Launch> selected = new ArrayList<>();
            if (run.isCancelled()) {
                cancelPending();
            } else {
                promoteReadyTasks();
                selected.addAll(selectLaunches());
            }
            if (run.allTasksTerminal()) {
                run.signalAllTerminal();
            }
            return selected;
        });

        boolean rejected = false;
        for (Launch launch : launches) {
            try {
                workers.execute(() -> runAttempt(launch));
            } catch (RejectedExecutionException e) {
                onAttemptFailed(launch, e);
                rejected = true;
            }
        }
        if (rejected) {
            tick();
        }
    }

    // Lock held. Repeats until stable because a skip can unblock further skips downstream.
    private void promoteReadyTasks() {
        boolean changed = true;
        while (changed) {
            changed = false;
            DependencyGraph graph = run.getGraph();
            for (String role : graph.readySet(run.states())) {
                AgentTask task = run.task(role);
                Prerequisite unmet = firstUnmetMandatory(task);
                if (unmet != null) {
                    TaskState prerequisiteState = run.task(unmet.role()).getState();
                    DependencyUnmetException reason =
                        new DependencyUnmetException(role, unmet.role(), prerequisiteState.name());
                    FailureRecord record = failure(role, 0, ErrorClass.DEPENDENCY_UNMET, reason.getMessage());
                    task.markSkipped(record);
                    run.addFailure(record);
                    log.warn("Run {}: {}", run.getRunId(), reason.getMessage());
                } else {
                    for (Prerequisite prerequisite : task.getPrerequisites()) {
                        if (run.task(prerequisite.role()).getState().isUnsuccessfulEnd()) {
                            log.info("Run {}: {} proceeds without optional prerequisite {}",
                                run.getRunId(), role, prerequisite.role());
                        }
                    }
                    task.markReady();
                }
                changed = true;
            }
        }
    }

    private Prerequisite firstUnmetMandatory(AgentTask task) {
        for (Prerequisite prerequisite : task.getPrerequisites()) {
            if (!prerequisite.optional() && run.task(prerequisite.role()).getState().isUnsuccessfulEnd()) {
                return prerequisite;
            }
        }
        return null;
    }

    // Lock held.
    private List<Launch> selectLaunches() {
        long budget = run.getOptions().getMaxConcurrent() - run.runningCount();
        if (budget <= 0) {
            return List.of();
        }
        long now = System.nanoTime();
        DependencyGraph graph = run.getGraph();
        List<AgentTask> candidates = new ArrayList<>();
        for (AgentTask task : run.tasks()) {
            if (task.isLaunchable(now)) {
                candidates.add(task);
            }
        }
        candidates.sort(Comparator
            .comparingInt((AgentTask t) -> pendingDependents(t.getRole())).reversed()
            .thenComparingInt(t -> graph.indexOf(t.getRole())));

        List<Launch> launches = new ArrayList<>();
        for (AgentTask task : candidates) {
            if (launches.size() >= budget) {
                break;
            }
            int attempt = task.markRunning();
            log.info("Run {}: launching {} (attempt {})", run.getRunId(), task.getRole(), attempt);
            launches.add(new Launch(task, attempt));
        }
        return launches;
    }

    private int pendingDependents(String role) {
        int pending = 0;
        for (String dependent : run.getGraph().dependentsOf(role)) {
            if (!run.task(dependent).getState().isTerminal()) {
                pending++;
            }
        }
        return pending;
    }

    // Lock held.
    private void cancelPending() {
        for (AgentTask task : run.tasks()) {
            if (task.getState() == TaskState.WAITING || task.getState() == TaskState.READY) {
                FailureRecord record = failure(task.getRole(), task.getAttempts(), ErrorClass.CANCELLED,
                    "Run cancelled before the role was launched");
                task.markSkipped(record);
                run.addFailure(record);
            }
        }
    }

    private void runAttempt(Launch launch) {
        try {
            TaskInput input = assembleInput(launch.task());
            AgentDefinition agent = run.getConfiguration().require(launch.task().getRole());
            AgentResult result = attemptRunner.run(agent, input, run.getConfiguration().getDefaultParams(), launch.attempt());
            onAttemptSucceeded(launch, result);
        } catch (Exception e) {
            onAttemptFailed(launch, e);
        } finally {
            tick();
        }
    }

    private TaskInput assembleInput(AgentTask task) {
        String role = task.getRole();
        Map<String, AgentResult> upstream = new LinkedHashMap<>();
        Map<String, TaskState> omitted = new LinkedHashMap<>();
        run.withLock(() -> {
            for (Prerequisite prerequisite : task.getPrerequisites()) {
                AgentTask upstreamTask = run.task(prerequisite.role());
                if (upstreamTask.getState() == TaskState.SUCCEEDED) {
                    run.getResultStore().get(prerequisite.role()).ifPresent(r -> upstream.put(prerequisite.role(), r));
                } else {
                    omitted.put(prerequisite.role(), upstreamTask.getState());
                }
            }
        });
        DataPayload data = dataProvider.loadInput(role);
        return new TaskInput(role, data, upstream, omitted);
    }

    private void onAttemptSucceeded(Launch launch, AgentResult result) {
        run.withLock(() -> {
            AgentTask task = launch.task();
            if (!isCurrent(launch)) {
                log.debug("Run {}: discarding stale reply for {} attempt {}", run.getRunId(), task.getRole(), launch.attempt());
                return;
            }
            if (run.isCancelled()) {
                FailureRecord record = failure(task.getRole(), launch.attempt(), ErrorClass.CANCELLED,
                    "Run cancelled, reply discarded");
                task.markFailed(record);
                run.addFailure(record);
                return;
            }
            run.getResultStore().put(task.getRole(), result);
            task.markSucceeded();
            log.info("Run {}: {} succeeded after {} attempt(s) in {} ms",
                run.getRunId(), task.getRole(), launch.attempt(), result.getLatencyMillis());
        });
    }

    private void onAttemptFailed(Launch launch, Exception error) {
        ErrorClass errorClass = classifier.classify(error);
        String message = classifier.describe(error);
        run.withLock(() -> {
            AgentTask task = launch.task();
            if (!isCurrent(launch)) {
                return;
            }
            if (run.isCancelled()) {
                FailureRecord record = failure(task.getRole(), launch.attempt(), ErrorClass.CANCELLED,
                    "Run cancelled: " + message);
                task.markFailed(record);
                run.addFailure(record);
                return;
            }
            FailureRecord record = failure(task.getRole(), launch.attempt(), errorClass, message);
            run.addFailure(record);
            if (retryPolicy.shouldRetry(errorClass, launch.attempt())) {
                Duration delay = retryPolicy.backoff(launch.attempt());
                task.scheduleRetry(record, delay);
                log.warn("Run {}: {} attempt {} failed ({}), retrying in {} ms: {}",
                    run.getRunId(), task.getRole(), launch.attempt(), errorClass, delay.toMillis(), message);
                scheduleTick(delay);
            } else {
                task.markFailed(record);
                log.warn("Run {}: {} failed after {} attempt(s) ({}): {}",
                    run.getRunId(), task.getRole(), launch.attempt(), errorClass, message);
            }
        });
    }

    private boolean isCurrent(Launch launch) {
        AgentTask task = launch.task();
        return task.getState() == TaskState.RUNNING && task.getAttempts() == launch.attempt();
    }

    private void scheduleTick(Duration delay) {
        try {
            timer.schedule(this::tick, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("Run {}: retry timer unavailable, retry not scheduled", run.getRunId());
        }
    }

    private FailureRecord failure(String role, int attempt, ErrorClass errorClass, String message) {
        return FailureRecord.builder()
            .role(role)
            .attempt(attempt)
            .errorClass(errorClass)
            .message(message)
            .timestamp(Instant.now())
            .build();
    }

    private record Launch(AgentTask task, int attempt) {
    }
}
