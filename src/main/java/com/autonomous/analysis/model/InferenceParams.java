package com.autonomous.analysis.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class InferenceParams {
    String model;
    String systemPrompt;
    @Builder.Default
    double temperature = 0.1;
    @Builder.Default
    int maxTokens = 4000;
}
