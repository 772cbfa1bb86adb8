package com.autonomous.analysis.cli;

import com.autonomous.analysis.config.AnalysisProperties;
import com.autonomous.analysis.exception.ConfigurationException;
import com.autonomous.analysis.model.AnalysisRequest;
import com.autonomous.analysis.model.FailureRecord;
import com.autonomous.analysis.model.RoleStatus;
import com.autonomous.analysis.model.RunStatus;
import com.autonomous.analysis.model.RunSummary;
import com.autonomous.analysis.service.AnalysisOrchestratorService;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * One-shot analysis from the command line:
 * {@code --focus=macro,finance --max-concurrent=2 --max-retries=1 --no-charts}.
 * The exit code is non-zero when the run failed or was rejected.
 */
@Component
@ConditionalOnProperty(prefix = "analysis.cli", name = "enabled", havingValue = "true")
public class AnalysisCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    private final AnalysisOrchestratorService orchestratorService;
    private final AnalysisProperties properties;
    private final PrintStream out;

    private int exitCode = 0;

    public AnalysisCommandLineRunner(AnalysisOrchestratorService orchestratorService, AnalysisProperties properties) {
        this(orchestratorService, properties, System.out);
    }

    AnalysisCommandLineRunner(AnalysisOrchestratorService orchestratorService, AnalysisProperties properties,
                              PrintStream out) {
        this.orchestratorService = orchestratorService;
        this.properties = properties;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        AnalysisRequest request;
        try {
            request = toRequest(args);
        } catch (NumberFormatException e) {
            out.println("Invalid option value: " + e.getMessage());
            exitCode = 2;
            return;
        }

        RunSummary summary;
        try {
            summary = orchestratorService.runAnalysis(request);
        } catch (ConfigurationException e) {
            out.println("Configuration error: " + e.getMessage());
            exitCode = 2;
            return;
        }

        print(summary);
        exitCode = summary.getStatus() == RunStatus.FAILED ? 1 : 0;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    AnalysisRequest toRequest(ApplicationArguments args) {
        List<String> roles = new ArrayList<>();
        if (args.containsOption("focus")) {
            for (String value : args.getOptionValues("focus")) {
                Arrays.stream(value.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(roles::add);
            }
        }
        Integer maxConcurrent = intOption(args, "max-concurrent");
        Integer maxRetries = intOption(args, "max-retries");
        Boolean enableCharts = args.containsOption("no-charts") ? Boolean.FALSE : null;
        return new AnalysisRequest(roles, maxConcurrent, maxRetries, null, enableCharts);
    }

    private Integer intOption(ApplicationArguments args, String name) {
        if (!args.containsOption(name) || args.getOptionValues(name).isEmpty()) {
            return null;
        }
        return Integer.parseInt(args.getOptionValues(name).get(0).trim());
    }

    private void print(RunSummary summary) {
        out.println("Analysis " + summary.getRunId() + ": " + summary.getStatus());
        for (RoleStatus status : summary.getRoleStatuses()) {
            out.printf("  %-10s %-10s attempts=%d%s%n", status.getRole(), status.getState(), status.getAttempts(),
                status.getLastError() != null ? "  " + status.getLastError() : "");
        }
        if (!summary.getFailures().isEmpty()) {
            out.println("Failures:");
            for (FailureRecord failure : summary.getFailures()) {
                out.printf("  %s attempt %d %s: %s%n", failure.getRole(), failure.getAttempt(),
                    failure.getErrorClass(), failure.getMessage());
            }
        }
        out.println("Tokens: " + (summary.getTotalInputTokens() + summary.getTotalOutputTokens()));
        out.println("Artifacts saved to: "
            + Paths.get(properties.getOutput().getPath(), summary.getRunId()).toAbsolutePath());
    }
}
