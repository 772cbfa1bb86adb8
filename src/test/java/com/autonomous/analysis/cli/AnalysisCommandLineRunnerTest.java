package com.autonomous.analysis.cli;

import com.autonomous.analysis.config.AnalysisProperties;
import com.autonomous.analysis.exception.ConfigurationException;
import com.autonomous.analysis.model.AnalysisRequest;
import com.autonomous.analysis.model.RoleStatus;
import com.autonomous.analysis.model.RunStatus;
import com.autonomous.analysis.model.RunSummary;
import com.autonomous.analysis.model.TaskState;
import com.autonomous.analysis.service.AnalysisOrchestratorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AnalysisCommandLineRunnerTest {

    private AnalysisOrchestratorService service;
    private ByteArrayOutputStream output;
    private AnalysisCommandLineRunner runner;

    @BeforeEach
    void setUp() {
        service = mock(AnalysisOrchestratorService.class);
        output = new ByteArrayOutputStream();
        runner = new AnalysisCommandLineRunner(service, new AnalysisProperties(),
            new PrintStream(output, true, StandardCharsets.UTF_8));
    }

    private static RunSummary summary(RunStatus status) {
        return RunSummary.builder()
            .runId("run-9")
            .status(status)
            .selectedRoles(List.of("macro"))
            .roleStatuses(List.of(RoleStatus.builder().role("macro").state(TaskState.SUCCEEDED).attempts(1).build()))
            .failures(List.of())
            .results(List.of())
            .totalInputTokens(100)
            .totalOutputTokens(20)
            .build();
    }

    @Test
    void shouldParseOptions() {
        AnalysisRequest request = runner.toRequest(new DefaultApplicationArguments(
            "--focus=macro, finance", "--focus=policy", "--max-concurrent=2", "--max-retries=0", "--no-charts"));

        assertEquals(List.of("macro", "finance", "policy"), request.roles());
        assertEquals(2, request.maxConcurrent());
        assertEquals(0, request.maxRetries());
        assertEquals(Boolean.FALSE, request.enableCharts());
    }

    @Test
    void shouldRunAllRolesByDefault() {
        AnalysisRequest request = runner.toRequest(new DefaultApplicationArguments());

        assertTrue(request.roles().isEmpty());
        assertNull(request.maxConcurrent());
        assertNull(request.enableCharts());
    }

    @Test
    void shouldPrintSummaryAndExitCleanly() {
        when(service.runAnalysis(any(AnalysisRequest.class))).thenReturn(summary(RunStatus.COMPLETED));

        runner.run(new DefaultApplicationArguments("--focus=macro"));

        String printed = output.toString(StandardCharsets.UTF_8);
        assertTrue(printed.contains("Analysis run-9: COMPLETED"));
        assertTrue(printed.contains("macro"));
        assertTrue(printed.contains("Tokens: 120"));
        assertTrue(printed.contains("Artifacts saved to:"));
        assertEquals(0, runner.getExitCode());
    }

    @Test
    void shouldExitWithOneWhenRunFailed() {
        when(service.runAnalysis(any(AnalysisRequest.class))).thenReturn(summary(RunStatus.FAILED));

        runner.run(new DefaultApplicationArguments());

        assertEquals(1, runner.getExitCode());
    }

    @Test
    void shouldExitWithTwoOnConfigurationError() {
        when(service.runAnalysis(any(AnalysisRequest.class)))
            .thenThrow(new ConfigurationException("Unknown analysis role(s): weather"));

        runner.run(new DefaultApplicationArguments("--focus=weather"));

        assertEquals(2, runner.getExitCode());
        assertTrue(output.toString(StandardCharsets.UTF_8).contains("Configuration error: Unknown analysis role(s): weather"));
    }

    @Test
    void shouldExitWithTwoOnBadNumber() {
        runner.run(new DefaultApplicationArguments("--max-concurrent=many"));

        assertEquals(2, runner.getExitCode());
        verifyNoInteractions(service);
    }
}
