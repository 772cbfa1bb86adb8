package com.autonomous.analysis.orchestration;

import com.autonomous.analysis.client.InferenceClient;
import com.autonomous.analysis.data.RawDataProvider;
import com.autonomous.analysis.exception.AggregationException;
import com.autonomous.analysis.model.ReportArtifact;
import com.autonomous.analysis.model.RunOptions;
import com.autonomous.analysis.model.RunStatus;
import com.autonomous.analysis.model.RunSummary;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the orchestration core. One call runs a whole analysis: schedule the
 * selected roles, synthesize the report, and return the run summary.
 *
 * <p>Only {@link com.autonomous.analysis.exception.ConfigurationException} escapes, and only
 * before anything was launched. Every other failure ends up in the summary.</p>
 */
@Slf4j
public class AnalysisEngine {

    private final InferenceClient inferenceClient;
    private final RawDataProvider dataProvider;
    private final ResultParser resultParser;
    private final FailureClassifier classifier;

    public AnalysisEngine(InferenceClient inferenceClient, RawDataProvider dataProvider,
                          ResultParser resultParser, FailureClassifier classifier) {
        this.inferenceClient = inferenceClient;
        this.dataProvider = dataProvider;
        this.resultParser = resultParser;
        this.classifier = classifier;
    }

    public RunSummary runAnalysis(AnalysisConfiguration configuration, Set<String> selectedRoles, RunOptions options) {
        return execute(prepare(configuration, selectedRoles, options));
    }

    /**
     * Validates the options and the selection and creates a pending run.
     */
    public AnalysisRun prepare(AnalysisConfiguration configuration, Collection<String> selectedRoles, RunOptions options) {
        RunOptions validated = (options != null ? options : RunOptions.defaults()).validate();
        Collection<String> selection = selectedRoles != null ? selectedRoles : List.of();
        DependencyGraph graph = configuration.getGraph().subgraph(selection);
        return new AnalysisRun(configuration, graph, selection, validated);
    }

    public RunSummary execute(AnalysisRun run) {
        RunOptions options = run.getOptions();
        RetryPolicy retryPolicy = RetryPolicy.from(options);
        ExecutorService workers = Executors.newCachedThreadPool(threads(run.getRunId() + "-worker"));
        ExecutorService calls = Executors.newCachedThreadPool(threads(run.getRunId() + "-call"));
        ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(threads(run.getRunId() + "-timer"));

        run.markStarted();
        log.info("Run {} started: roles={}, maxConcurrent={}, maxRetries={}, timeout={}s",
            run.getRunId(), run.getGraph().roles(), options.getMaxConcurrent(), options.getMaxRetries(),
            options.getTaskTimeout().toSeconds());
        try {
            AttemptRunner attemptRunner = new AttemptRunner(inferenceClient, resultParser, calls, options.getTaskTimeout());
            new RunScheduler(run, attemptRunner, dataProvider, retryPolicy, classifier, workers, timer).execute();
            // From here on only synthesis calls are in flight.
            run.onCancel(calls::shutdownNow);

            RunStatus status;
            ReportArtifact report = null;
            if (run.isCancelled()) {
                status = RunStatus.CANCELLED;
            } else {
                try {
                    report = new Aggregator(attemptRunner, retryPolicy, classifier).aggregate(run);
                    status = run.withLock(run::allTasksSucceeded) ? RunStatus.COMPLETED : RunStatus.COMPLETED_WITH_ERRORS;
                } catch (AggregationException e) {
                    log.warn("Run {}: {}", run.getRunId(), e.getMessage());
                    status = run.isCancelled() ? RunStatus.CANCELLED : RunStatus.FAILED;
                }
            }
            status = run.markFinished(status, report);
            if (status == RunStatus.CANCELLED && report != null) {
                log.info("Run {} cancelled after synthesis, report discarded", run.getRunId());
            }
        } finally {
            workers.shutdownNow();
            calls.shutdownNow();
            timer.shutdownNow();
        }

        RunSummary summary = run.toSummary();
        log.info("Run {} finished with status {}: {} result(s), {} failure record(s)",
            summary.getRunId(), summary.getStatus(), summary.getResults().size(), summary.getFailures().size());
        return summary;
    }

    private static ThreadFactory threads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
