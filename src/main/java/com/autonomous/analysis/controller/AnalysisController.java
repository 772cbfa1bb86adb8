package com.autonomous.analysis.controller;

import com.autonomous.analysis.exception.RunNotFoundException;
import com.autonomous.analysis.model.AnalysisRequest;
import com.autonomous.analysis.model.RoleDefinition;
import com.autonomous.analysis.model.RunSummary;
import com.autonomous.analysis.service.AnalysisOrchestratorService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/analysis")
public class AnalysisController {

    private final AnalysisOrchestratorService orchestratorService;

    public AnalysisController(AnalysisOrchestratorService orchestratorService) {
        this.orchestratorService = orchestratorService;
    }

    @PostMapping("/runs")
    public RunSummary run(@Valid @RequestBody AnalysisRequest request) {
        return orchestratorService.runAnalysis(request);
    }

    @PostMapping("/runs/async")
    public ResponseEntity<Map<String, String>> start(@Valid @RequestBody AnalysisRequest request) {
        String runId = orchestratorService.startRun(request);
        return ResponseEntity.accepted().body(Map.of("runId", runId, "status", "ACCEPTED"));
    }

    @GetMapping("/runs/{runId}")
    public RunSummary getRun(@PathVariable String runId) {
        return orchestratorService.getRun(runId)
            .orElseThrow(() -> new RunNotFoundException(runId));
    }

    @DeleteMapping("/runs/{runId}")
    public RunSummary cancelRun(@PathVariable String runId) {
        return orchestratorService.cancelRun(runId);
    }

    @GetMapping("/roles")
    public List<RoleDefinition> roles() {
        return orchestratorService.listRoles();
    }

    @GetMapping("/usage")
    public Map<String, Object> usage() {
        return orchestratorService.usage();
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }
}
