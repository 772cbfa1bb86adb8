package com.autonomous.analysis.orchestration;

import com.autonomous.analysis.exception.ConfigurationException;
import com.autonomous.analysis.model.InferenceParams;
import com.autonomous.analysis.model.RoleDefinition;
import com.autonomous.analysis.prompt.PromptAssembler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class AnalysisConfiguration {

    private final Map<String, AgentDefinition> agents;
    private final AgentDefinition synthesis;
    private final DependencyGraph graph;
    private final InferenceParams defaultParams;

    private AnalysisConfiguration(Builder builder) {
        if (builder.agents.isEmpty()) {
            throw new ConfigurationException("No analysis roles declared");
        }
        if (builder.synthesis == null) {
            throw new ConfigurationException("No synthesis role declared");
        }
        Map<String, AgentDefinition> byRole = new LinkedHashMap<>();
        for (AgentDefinition agent : builder.agents) {
            if (byRole.put(agent.role(), agent) != null) {
                throw new ConfigurationException("Role '" + agent.role() + "' is declared more than once");
            }
        }
        if (byRole.containsKey(builder.synthesis.role())) {
            throw new ConfigurationException(
                "Synthesis role '" + builder.synthesis.role() + "' clashes with an analysis role");
        }
        this.agents = Collections.unmodifiableMap(byRole);
        this.synthesis = builder.synthesis;
        this.graph = DependencyGraph.fromDefinitions(
            builder.agents.stream().map(AgentDefinition::definition).toList());
        this.defaultParams = builder.defaultParams;
    }

    public static Builder builder() {
        return new Builder();
    }

    public DependencyGraph getGraph() {
        return graph;
    }

    public AgentDefinition getSynthesis() {
        return synthesis;
    }

    public InferenceParams getDefaultParams() {
        return defaultParams;
    }

    public List<String> roles() {
        return graph.roles();
    }

    public Optional<AgentDefinition> find(String role) {
        return Optional.ofNullable(agents.get(role));
    }

    public AgentDefinition require(String role) {
        return find(role).orElseThrow(() -> new ConfigurationException("Unknown analysis role '" + role + "'"));
    }

    public static class Builder {
        private final List<AgentDefinition> agents = new ArrayList<>();
        private AgentDefinition synthesis;
        private InferenceParams defaultParams = InferenceParams.builder().build();

        public Builder agent(RoleDefinition definition, PromptAssembler assembler) {
            agents.add(new AgentDefinition(definition, assembler));
            return this;
        }

        public Builder synthesis(RoleDefinition definition, PromptAssembler assembler) {
            this.synthesis = new AgentDefinition(definition, assembler);
            return this;
        }

        public Builder defaultParams(InferenceParams defaultParams) {
            this.defaultParams = defaultParams;
            return this;
        }

        public AnalysisConfiguration build() {
            return new AnalysisConfiguration(this);
        }
    }
}
