package com.autonomous.analysis.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InferenceResponse {
    String text;
    String model;
    long inputTokens;
    long outputTokens;

    public static InferenceResponse ofText(String text) {
        return InferenceResponse.builder().text(text).build();
    }
}
