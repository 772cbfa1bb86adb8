package com.autonomous.analysis.service;

import com.autonomous.analysis.config.AnalysisProperties;
import com.autonomous.analysis.exception.ConfigurationException;
import com.autonomous.analysis.model.RoleDefinition;
import com.autonomous.analysis.orchestration.AnalysisConfiguration;
import com.autonomous.analysis.prompt.PromptAssembler;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.File;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
public class RoleCatalogService {

    private final AnalysisProperties properties;
    private final Map<String, PromptAssembler> assemblers;
    private final ObjectMapper yamlMapper;

    private String rolesPath;
    private volatile List<RoleDefinition> definitions = List.of();

    public RoleCatalogService(AnalysisProperties properties, Map<String, PromptAssembler> assemblers) {
        this.properties = properties;
        this.assemblers = assemblers;
        this.rolesPath = properties.getRolesPath();
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.yamlMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.yamlMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void setRolesPath(String path) {
        this.rolesPath = path;
    }

    @PostConstruct
    public void loadRoles() {
        File rolesDir = new File(rolesPath);
        if (!rolesDir.isDirectory()) {
            log.warn("Role directory not found: {}", rolesPath);
            definitions = List.of();
            return;
        }

        File[] yamlFiles = rolesDir.listFiles((dir, name) -> name.endsWith(".yaml") || name.endsWith(".yml"));
        List<RoleDefinition> loaded = new ArrayList<>();
        if (yamlFiles != null) {
            for (File file : yamlFiles) {
                try {
                    RoleDefinition definition = yamlMapper.readValue(file, RoleDefinition.class);
                    if (definition == null || definition.getRole() == null || definition.getRole().isBlank()) {
                        log.warn("Skipping {}: no role name", file.getName());
                        continue;
                    }
                    loaded.add(definition);
                    log.info("Loaded role: {}", definition.getRole());
                } catch (Exception e) {
                    log.error("Failed to load role from {}: {}", file.getName(), e.getMessage());
                }
            }
        }
        loaded.sort(Comparator.comparingInt(RoleDefinition::getOrder).thenComparing(RoleDefinition::getRole));
        definitions = List.copyOf(loaded);
    }

    public List<RoleDefinition> getDefinitions() {
        return definitions;
    }

    public Optional<RoleDefinition> find(String role) {
        return definitions.stream().filter(d -> d.getRole().equals(role)).findFirst();
    }

    public List<String> dataFilesOf(String role) {
        return find(role).map(RoleDefinition::getDataFiles).orElse(List.of());
    }

    public String displayNameOf(String role) {
        return find(role).map(RoleDefinition::getDisplayName).orElse(role);
    }

    /**
     * @throws ConfigurationException when the synthesis role is missing, a prompt assembler is
     *                                unknown, or the roles do not form a valid dependency graph
     */
    public AnalysisConfiguration buildConfiguration() {
        String synthesisRole = properties.getSynthesisRole();
        AnalysisConfiguration.Builder builder = AnalysisConfiguration.builder()
            .defaultParams(properties.getInference().toParams());
        boolean synthesisFound = false;
        for (RoleDefinition definition : definitions) {
            PromptAssembler assembler = assemblerFor(definition);
            if (definition.isSynthesis() || definition.getRole().equals(synthesisRole)) {
                if (synthesisFound) {
                    throw new ConfigurationException("More than one synthesis role declared");
                }
                builder.synthesis(definition, assembler);
                synthesisFound = true;
            } else {
                builder.agent(definition, assembler);
            }
        }
        return builder.build();
    }

    private PromptAssembler assemblerFor(RoleDefinition definition) {
        PromptAssembler assembler = assemblers.get(definition.getPromptAssembler());
        if (assembler == null) {
            throw new ConfigurationException(String.format("Role '%s' references unknown prompt assembler '%s'",
                definition.getRole(), definition.getPromptAssembler()));
        }
        return assembler;
    }
}
