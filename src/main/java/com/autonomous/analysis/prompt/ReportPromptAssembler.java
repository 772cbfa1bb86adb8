package com.autonomous.analysis.prompt;

import com.autonomous.analysis.model.RoleDefinition;
import com.autonomous.analysis.model.TaskInput;
import org.springframework.stereotype.Component;

@Component(ReportPromptAssembler.NAME)
public class ReportPromptAssembler implements PromptAssembler {

    public static final String NAME = "report";

    private final TemplatePromptAssembler templates;

    public ReportPromptAssembler(TemplatePromptAssembler templates) {
        this.templates = templates;
    }

    @Override
    public String assemble(RoleDefinition role, TaskInput input) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Write a complete industry analysis report from the following analysis results.\n\n");
        input.upstream().forEach((name, result) -> {
            prompt.append("## ").append(name).append('\n');
            prompt.append(result.getSummary() != null ? result.getSummary() : result.getContent()).append("\n\n");
        });
        if (input.hasOmissions()) {
            prompt.append(TemplatePromptAssembler.renderOmitted(input.omitted()))
                .append(". Do not invent findings for them.\n\n");
        }
        if (role.getPromptTemplate() != null && !role.getPromptTemplate().isBlank()) {
            prompt.append(templates.assemble(role, input));
        }
        return prompt.toString().trim();
    }
}
