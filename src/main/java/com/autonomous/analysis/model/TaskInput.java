package com.autonomous.analysis.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record TaskInput(
    String role,
    DataPayload data,
    Map<String, AgentResult> upstream,
    Map<String, TaskState> omitted
) {

    public TaskInput {
        upstream = Collections.unmodifiableMap(new LinkedHashMap<>(upstream));
        omitted = Collections.unmodifiableMap(new LinkedHashMap<>(omitted));
    }

    public boolean hasOmissions() {
        return !omitted.isEmpty();
    }
}
