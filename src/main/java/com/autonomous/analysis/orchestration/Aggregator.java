package com.autonomous.analysis.orchestration;

import com.autonomous.analysis.exception.AggregationException;
import com.autonomous.analysis.model.AgentResult;
import com.autonomous.analysis.model.DataPayload;
import com.autonomous.analysis.model.ErrorClass;
import com.autonomous.analysis.model.FailureRecord;
import com.autonomous.analysis.model.ReportArtifact;
import com.autonomous.analysis.model.TaskInput;
import com.autonomous.analysis.model.TaskState;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Invokes the synthesis role once every task of the run is terminal.
 *
 * <p>The synthesis payload holds the succeeded results in declared role order. Failed and
 * skipped roles appear only as omissions. Attempts follow the run's retry policy.</p>
 */
@Slf4j
public class Aggregator {

    private final AttemptRunner attemptRunner;
    private final RetryPolicy retryPolicy;
    private final FailureClassifier classifier;

    public Aggregator(AttemptRunner attemptRunner, RetryPolicy retryPolicy, FailureClassifier classifier) {
        this.attemptRunner = attemptRunner;
        this.retryPolicy = retryPolicy;
        this.classifier = classifier;
    }

    /**
     * @return the report artifact
     * @throws AggregationException when no task succeeded, or every synthesis attempt failed
     */
    public ReportArtifact aggregate(AnalysisRun run) {
        AgentDefinition synthesis = run.getConfiguration().getSynthesis();
        AgentTask task = run.synthesisTask();
        TaskInput input = run.withLock(() -> synthesisInput(run));

        if (input.upstream().isEmpty()) {
            String message = "No analysis role succeeded, nothing to synthesize";
            run.withLock(() -> {
                FailureRecord record = failure(synthesis.role(), 0, ErrorClass.AGGREGATION, message);
                task.markSkipped(record);
                run.addFailure(record);
            });
            throw new AggregationException(message, 0);
        }

        Exception lastError = null;
        int attempt = 0;
        while (true) {
            if (run.isCancelled()) {
                String message = "Run cancelled before synthesis";
                int attempts = attempt;
                run.withLock(() -> {
                    if (!task.getState().isTerminal()) {
                        FailureRecord record = failure(synthesis.role(), attempts, ErrorClass.CANCELLED, message);
                        task.markSkipped(record);
                        run.addFailure(record);
                    }
                });
                throw new AggregationException(message, attempt);
            }
            attempt = run.withLock(() -> {
                if (task.getState() == TaskState.WAITING) {
                    task.markReady();
                }
                return task.markRunning();
            });
            AgentResult result;
            try {
                result = attemptRunner.run(synthesis, input, run.getConfiguration().getDefaultParams(), attempt);
            } catch (Exception e) {
                lastError = e;
                ErrorClass errorClass = classifier.classify(e);
                String message = classifier.describe(e);
                FailureRecord record = failure(synthesis.role(), attempt, errorClass, message);
                if (run.isCancelled()) {
                    throw discardCancelled(run, task, synthesis.role(), attempt, record);
                }
                if (!retryPolicy.shouldRetry(errorClass, attempt)) {
                    run.withLock(() -> run.addFailure(record));
                    break;
                }
                Duration delay = retryPolicy.backoff(attempt);
                run.withLock(() -> {
                    task.scheduleRetry(record, delay);
                    run.addFailure(record);
                });
                log.warn("Run {}: synthesis attempt {} failed ({}), retrying in {} ms: {}",
                    run.getRunId(), attempt, errorClass, delay.toMillis(), message);
                awaitBackoff(run, delay, attempt);
                continue;
            }
            if (run.isCancelled()) {
                throw discardCancelled(run, task, synthesis.role(), attempt, null);
            }
            run.withLock(task::markSucceeded);
            log.info("Run {}: synthesis by {} succeeded on attempt {}", run.getRunId(), synthesis.role(), attempt);
            return toReport(run, synthesis.role(), input, result);
        }

        String message = "Synthesis failed after " + attempt + " attempt(s): " + classifier.describe(lastError);
        FailureRecord exhausted = failure(synthesis.role(), attempt, ErrorClass.AGGREGATION, message);
        run.withLock(() -> {
            task.markFailed(exhausted);
            run.addFailure(exhausted);
        });
        throw new AggregationException(message, attempt, lastError);
    }

    // The reply or error of an attempt that finished after cancellation is dropped.
    private AggregationException discardCancelled(AnalysisRun run, AgentTask task, String role, int attempt, FailureRecord error) {
        run.withLock(() -> {
            if (error != null) {
                run.addFailure(error);
            }
            FailureRecord record = failure(role, attempt, ErrorClass.CANCELLED, "Run cancelled, synthesis reply discarded");
            task.markFailed(record);
            run.addFailure(record);
        });
        return new AggregationException("Run cancelled during synthesis", attempt);
    }

    // Lock held.
    private TaskInput synthesisInput(AnalysisRun run) {
        Map<String, AgentResult> upstream = new LinkedHashMap<>(run.getResultStore().snapshot());
        Map<String, TaskState> omitted = new LinkedHashMap<>();
        for (AgentTask task : run.tasks()) {
            if (task.getState() != TaskState.SUCCEEDED) {
                omitted.put(task.getRole(), task.getState());
            }
        }
        String role = run.getConfiguration().getSynthesis().role();
        return new TaskInput(role, DataPayload.empty(role), upstream, omitted);
    }

    private ReportArtifact toReport(AnalysisRun run, String role, TaskInput input, AgentResult result) {
        return ReportArtifact.builder()
            .runId(run.getRunId())
            .role(role)
            .content(result.getSummary())
            .timestamp(result.getTimestamp())
            .sources(List.copyOf(input.upstream().values()))
            .omittedRoles(input.omitted())
            .model(result.getModel())
            .attempt(result.getAttempt())
            .latencyMillis(result.getLatencyMillis())
            .inputTokens(result.getInputTokens())
            .outputTokens(result.getOutputTokens())
            .build();
    }

    // Returns early on cancellation; the loop then records it.
    private void awaitBackoff(AnalysisRun run, Duration delay, int attempt) {
        try {
            if (run.awaitCancellation(delay)) {
                log.info("Run {}: synthesis backoff interrupted by cancellation", run.getRunId());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AggregationException("Interrupted while waiting to retry synthesis", attempt, e);
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
}
