package com.autonomous.analysis.orchestration;

import com.autonomous.analysis.model.AgentResult;
import com.autonomous.analysis.model.ErrorClass;
import com.autonomous.analysis.model.FailureRecord;
import com.autonomous.analysis.model.ReportArtifact;
import com.autonomous.analysis.model.RoleStatus;
import com.autonomous.analysis.model.RunOptions;
import com.autonomous.analysis.model.RunStatus;
import com.autonomous.analysis.model.RunSummary;
import com.autonomous.analysis.model.TaskState;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Shared state of one orchestration run: task states, results and failure records.
 *
 * <p>Every read-modify-write of task state goes through {@link #withLock}. The lock is never
 * held across an inference call.</p>
 */
@Slf4j
public class AnalysisRun {

    private static final DateTimeFormatter RUN_ID_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneId.systemDefault());

    @Getter
    private final String runId;
    @Getter
    private final AnalysisConfiguration configuration;
    @Getter
    private final DependencyGraph graph;
    @Getter
    private final RunOptions options;
    @Getter
    private final ResultStore resultStore;
    @Getter
    private final List<String> requestedRoles;
    @Getter
    private final Instant createdAt;

    private final Map<String, AgentTask> tasks = new LinkedHashMap<>();
    private final AgentTask synthesisTask;
    private final List<FailureRecord> failures = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final CompletableFuture<Void> allTerminal = new CompletableFuture<>();
    private final CountDownLatch cancelSignal = new CountDownLatch(1);

    private volatile RunStatus status = RunStatus.PENDING;
    private volatile boolean cancelled;
    private volatile Runnable cancellationListener = () -> { };
    private Instant startedAt;
    private Instant completedAt;
    private ReportArtifact report;

    public AnalysisRun(AnalysisConfiguration configuration, DependencyGraph graph,
                       Collection<String> requestedRoles, RunOptions options) {
        this.createdAt = Instant.now();
        this.runId = newRunId(createdAt);
        this.configuration = configuration;
        this.graph = graph;
        this.options = options;
        this.requestedRoles = List.copyOf(requestedRoles);
        this.resultStore = new ResultStore(graph.roles());
        for (String role : graph.roles()) {
            tasks.put(role, new AgentTask(role, graph.prerequisitesOf(role)));
        }
        this.synthesisTask = new AgentTask(configuration.getSynthesis().role(), List.of());
    }

    static String newRunId(Instant createdAt) {
        return RUN_ID_FORMAT.format(createdAt) + "-" + UUID.randomUUID().toString().substring(0, 6);
    }

    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    public RunStatus getStatus() {
        return status;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Stops new launches and interrupts the calls in flight. A reply that still arrives is
     * discarded, the synthesis reply included.
     */
    public void cancel() {
        boolean accepted = withLock(() -> {
            if (status.isFinished() || cancelled) {
                return false;
            }
            cancelled = true;
            return true;
        });
        if (!accepted) {
            return;
        }
        log.info("Run {} cancellation requested", runId);
        cancelSignal.countDown();
        cancellationListener.run();
    }

    /**
     * Waits up to {@code timeout}, returning early once the run is cancelled.
     *
     * @return true when the run was cancelled
     */
    boolean awaitCancellation(Duration timeout) throws InterruptedException {
        return cancelSignal.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    void onCancel(Runnable listener) {
        this.cancellationListener = listener;
    }

    void markStarted() {
        withLock(() -> {
            startedAt = Instant.now();
            status = RunStatus.RUNNING;
        });
    }

    /**
     * Records the final status. A cancellation accepted before this point wins: the status
     * becomes {@code CANCELLED} and any report is discarded.
     *
     * @return the status actually recorded
     */
    RunStatus markFinished(RunStatus finalStatus, ReportArtifact report) {
        return withLock(() -> {
            if (cancelled && finalStatus != RunStatus.CANCELLED) {
                if (report != null) {
                    failures.add(FailureRecord.builder()
                        .role(report.getRole())
                        .attempt(report.getAttempt())
                        .errorClass(ErrorClass.CANCELLED)
                        .message("Run cancelled, report discarded")
                        .timestamp(Instant.now())
                        .build());
                }
                this.report = null;
                this.status = RunStatus.CANCELLED;
            } else {
                this.report = report;
                this.status = finalStatus;
            }
            this.completedAt = Instant.now();
            return this.status;
        });
    }

    // --- task state, lock held by the caller ---

    AgentTask task(String role) {
        return tasks.get(role);
    }

    Collection<AgentTask> tasks() {
        return Collections.unmodifiableCollection(tasks.values());
    }

    AgentTask synthesisTask() {
        return synthesisTask;
    }

    Map<String, TaskState> states() {
        Map<String, TaskState> states = new LinkedHashMap<>();
        tasks.forEach((role, task) -> states.put(role, task.getState()));
        return states;
    }

    long runningCount() {
        return tasks.values().stream().filter(t -> t.getState() == TaskState.RUNNING).count();
    }

    boolean allTasksTerminal() {
        return tasks.values().stream().allMatch(t -> t.getState().isTerminal());
    }

    boolean allTasksSucceeded() {
        return tasks.values().stream().allMatch(t -> t.getState() == TaskState.SUCCEEDED);
    }

    void addFailure(FailureRecord failure) {
        failures.add(failure);
    }

    void signalAllTerminal() {
        allTerminal.complete(null);
    }

    void awaitAllTerminal() {
        allTerminal.join();
    }

    // --- views ---

    public RunSummary toSummary() {
        return withLock(() -> {
            List<RoleStatus> roleStatuses = new ArrayList<>();
            tasks.values().forEach(task -> roleStatuses.add(task.toStatus()));
            if (synthesisTask.getAttempts() > 0 || synthesisTask.getLastFailure() != null) {
                roleStatuses.add(synthesisTask.toStatus());
            }
            List<AgentResult> results = new ArrayList<>(resultStore.snapshot().values());
            long reportInput = report != null ? report.getInputTokens() : 0;
            long reportOutput = report != null ? report.getOutputTokens() : 0;
            long inputTokens = reportInput + results.stream().mapToLong(AgentResult::getInputTokens).sum();
            long outputTokens = reportOutput + results.stream().mapToLong(AgentResult::getOutputTokens).sum();
            return RunSummary.builder()
                .runId(runId)
                .status(status)
                .startedAt(startedAt != null ? startedAt : createdAt)
                .completedAt(completedAt)
                .selectedRoles(graph.roles())
                .options(options)
                .roleStatuses(List.copyOf(roleStatuses))
                .failures(List.copyOf(failures))
                .results(List.copyOf(results))
                .report(report)
                .totalInputTokens(inputTokens)
                .totalOutputTokens(outputTokens)
                .build();
        });
    }
}
