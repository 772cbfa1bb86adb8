package com.autonomous.analysis.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class ReportArtifact {
    String runId;
    String role;
    String content;
    Instant timestamp;
    List<AgentResult> sources;
    Map<String, TaskState> omittedRoles;

    String model;
    int attempt;
    long latencyMillis;
    long inputTokens;
    long outputTokens;
}
