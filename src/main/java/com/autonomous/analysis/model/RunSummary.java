package com.autonomous.analysis.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Value
@Builder
public class RunSummary {
    String runId;
    RunStatus status;
    Instant startedAt;
    Instant completedAt;
    List<String> selectedRoles;
    RunOptions options;
    List<RoleStatus> roleStatuses;
    List<FailureRecord> failures;
    List<AgentResult> results;
    ReportArtifact report;
    long totalInputTokens;
    long totalOutputTokens;

    public Optional<ReportArtifact> findReport() {
        return Optional.ofNullable(report);
    }

    public Optional<RoleStatus> findRole(String role) {
        return roleStatuses.stream().filter(s -> s.getRole().equals(role)).findFirst();
    }
}
