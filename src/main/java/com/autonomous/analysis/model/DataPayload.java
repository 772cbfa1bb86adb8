package com.autonomous.analysis.model;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
public class DataPayload {
    String role;
    Map<String, String> summaries;

    public static DataPayload empty(String role) {
        return new DataPayload(role, Map.of());
    }

    public static DataPayload of(String role, Map<String, String> summaries) {
        return new DataPayload(role, Collections.unmodifiableMap(new LinkedHashMap<>(summaries)));
    }

    public boolean isEmpty() {
        return summaries.isEmpty();
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        summaries.forEach((source, summary) -> {
            sb.append("Source: ").append(source).append('\n');
            sb.append(summary).append("\n\n");
        });
        return sb.toString().trim();
    }
}
