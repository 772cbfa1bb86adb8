package com.autonomous.analysis.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.util.List;

public record AnalysisRequest(
    List<String> roles,

    @Min(value = 1, message = "maxConcurrent must be >= 1")
    @Max(value = 32, message = "maxConcurrent must be <= 32")
    Integer maxConcurrent,

    @Min(value = 0, message = "maxRetries must be >= 0")
    @Max(value = 10, message = "maxRetries must be <= 10")
    Integer maxRetries,

    @Min(value = 1, message = "taskTimeoutSeconds must be >= 1")
    Long taskTimeoutSeconds,

    Boolean enableCharts
) {

    public static AnalysisRequest forRoles(List<String> roles) {
        return new AnalysisRequest(roles, null, null, null, null);
    }
}
