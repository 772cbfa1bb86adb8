package com.autonomous.analysis.orchestration;

import com.autonomous.analysis.model.InferenceParams;
import com.autonomous.analysis.model.RoleDefinition;
import com.autonomous.analysis.model.TaskInput;
import com.autonomous.analysis.prompt.PromptAssembler;

public record AgentDefinition(RoleDefinition definition, PromptAssembler assembler) {

    public String role() {
        return definition.getRole();
    }

    public String prompt(TaskInput input) {
        return assembler.assemble(definition, input);
    }

    public InferenceParams params(InferenceParams defaults) {
        InferenceParams.InferenceParamsBuilder builder = defaults.toBuilder()
            .systemPrompt(definition.getSystemPrompt());
        if (definition.getModel() != null && !definition.getModel().isBlank()) {
            builder.model(definition.getModel());
        }
        if (definition.getTemperature() != null) {
            builder.temperature(definition.getTemperature());
        }
        if (definition.getMaxTokens() != null) {
            builder.maxTokens(definition.getMaxTokens());
        }
        return builder.build();
    }
}
