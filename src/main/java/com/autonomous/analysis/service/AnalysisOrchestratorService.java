package com.autonomous.analysis.service;

import com.autonomous.analysis.config.AnalysisProperties;
import com.autonomous.analysis.exception.AnalysisException;
import com.autonomous.analysis.exception.RunNotFoundException;
import com.autonomous.analysis.model.AnalysisRequest;
import com.autonomous.analysis.model.RoleDefinition;
import com.autonomous.analysis.model.RunOptions;
import com.autonomous.analysis.model.RunStatus;
import com.autonomous.analysis.model.RunSummary;
import com.autonomous.analysis.orchestration.AnalysisConfiguration;
import com.autonomous.analysis.orchestration.AnalysisEngine;
import com.autonomous.analysis.orchestration.AnalysisRun;
import com.autonomous.analysis.sink.ArtifactSink;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

@Slf4j
@Service
public class AnalysisOrchestratorService {

    static final int MAX_FINISHED_RUNS = 100;

    private final RoleCatalogService roleCatalog;
    private final AnalysisEngine engine;
    private final AnalysisProperties properties;
    private final UsageTrackerService usageTracker;
    private final ArtifactSink artifactSink;
    private final SlackNotificationService slackNotifier;

    private final Map<String, AnalysisRun> activeRuns = new ConcurrentHashMap<>();
    private final Map<String, RunSummary> finishedRuns = Collections.synchronizedMap(
        new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, RunSummary> eldest) {
                return size() > MAX_FINISHED_RUNS;
            }
        });
    private final ExecutorService executor = Executors.newCachedThreadPool();

    public AnalysisOrchestratorService(RoleCatalogService roleCatalog, AnalysisEngine engine,
                                       AnalysisProperties properties, UsageTrackerService usageTracker,
                                       ArtifactSink artifactSink, SlackNotificationService slackNotifier) {
        this.roleCatalog = roleCatalog;
        this.engine = engine;
        this.properties = properties;
        this.usageTracker = usageTracker;
        this.artifactSink = artifactSink;
        this.slackNotifier = slackNotifier;
    }

    /**
     * Runs an analysis to completion.
     *
     * @throws com.autonomous.analysis.exception.ConfigurationException for an unknown role,
     *         invalid options or an invalid role catalog. Nothing is launched in that case.
     */
    public RunSummary runAnalysis(AnalysisRequest request) {
        return execute(prepare(request));
    }

    /**
     * Validates the request and runs the analysis in the background.
     *
     * @return the run id
     */
    public String startRun(AnalysisRequest request) {
        AnalysisRun run = prepare(request);
        try {
            executor.execute(() -> execute(run));
        } catch (RejectedExecutionException e) {
            activeRuns.remove(run.getRunId());
            throw new AnalysisException("Run " + run.getRunId() + " rejected, the orchestrator is shutting down", e);
        }
        return run.getRunId();
    }

    public Optional<RunSummary> getRun(String runId) {
        AnalysisRun active = activeRuns.get(runId);
        if (active != null) {
            return Optional.of(active.toSummary());
        }
        return Optional.ofNullable(finishedRuns.get(runId));
    }

    /**
     * Requests cancellation of an active run. A finished run is returned unchanged.
     */
    public RunSummary cancelRun(String runId) {
        AnalysisRun active = activeRuns.get(runId);
        if (active != null) {
            active.cancel();
            return active.toSummary();
        }
        return Optional.ofNullable(finishedRuns.get(runId))
            .orElseThrow(() -> new RunNotFoundException(runId));
    }

    public List<RoleDefinition> listRoles() {
        return roleCatalog.getDefinitions();
    }

    public List<String> activeRunIds() {
        return List.copyOf(activeRuns.keySet());
    }

    public Map<String, Object> usage() {
        return usageTracker.usageReport();
    }

    RunOptions toOptions(AnalysisRequest request) {
        RunOptions.RunOptionsBuilder options = properties.getRun().toOptions().toBuilder();
        if (request.maxConcurrent() != null) {
            options.maxConcurrent(request.maxConcurrent());
        }
        if (request.maxRetries() != null) {
            options.maxRetries(request.maxRetries());
        }
        if (request.taskTimeoutSeconds() != null) {
            options.taskTimeout(Duration.ofSeconds(request.taskTimeoutSeconds()));
        }
        if (request.enableCharts() != null) {
            options.enableCharts(request.enableCharts());
        }
        return options.build();
    }

    private AnalysisRun prepare(AnalysisRequest request) {
        AnalysisConfiguration configuration = roleCatalog.buildConfiguration();
        List<String> roles = request.roles() != null ? request.roles() : List.of();
        AnalysisRun run = engine.prepare(configuration, roles, toOptions(request));
        activeRuns.put(run.getRunId(), run);
        return run;
    }

    private RunSummary execute(AnalysisRun run) {
        String threadTs = slackNotifier.postRunStarted(run.getRunId(), run.getGraph().roles());
        RunSummary summary;
        try {
            summary = engine.execute(run);
        } catch (RuntimeException e) {
            log.error("Run {} aborted: {}", run.getRunId(), e.getMessage(), e);
            finishedRuns.put(run.getRunId(), run.toSummary());
            throw e;
        } finally {
            activeRuns.remove(run.getRunId());
        }
        finishedRuns.put(summary.getRunId(), summary);
        afterRun(summary, threadTs);
        return summary;
    }

    private void afterRun(RunSummary summary, String threadTs) {
        usageTracker.recordRun(summary);
        try {
            artifactSink.emit(summary);
        } catch (UncheckedIOException e) {
            log.error("Run {}: {}", summary.getRunId(), e.getMessage());
        }
        slackNotifier.postRunFinished(summary, threadTs);
        if (summary.getStatus() == RunStatus.FAILED) {
            log.warn("Run {} failed: {} failure record(s)", summary.getRunId(), summary.getFailures().size());
        }
    }

    @PreDestroy
    public void shutdown() {
        activeRuns.values().forEach(AnalysisRun::cancel);
        executor.shutdownNow();
    }
}
