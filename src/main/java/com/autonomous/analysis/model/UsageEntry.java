package com.autonomous.analysis.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageEntry {
    private Instant timestamp;
    private String runId;
    private String role;
    private String model;
    private long inputTokens;
    private long outputTokens;
    private long latencyMillis;
}
