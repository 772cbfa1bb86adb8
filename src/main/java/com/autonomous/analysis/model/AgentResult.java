package com.autonomous.analysis.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class AgentResult {
    String role;
    String content;
    @Singular
    Map<String, Object> fields;
    String summary;
    Instant timestamp;

    // Observability
    String model;
    int attempt;
    long latencyMillis;
    long inputTokens;
    long outputTokens;
}
