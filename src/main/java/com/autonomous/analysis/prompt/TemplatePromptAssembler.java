package com.autonomous.analysis.prompt;

import com.autonomous.analysis.model.AgentResult;
import com.autonomous.analysis.model.RoleDefinition;
import com.autonomous.analysis.model.TaskInput;
import com.autonomous.analysis.model.TaskState;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Fills the role's {@code prompt_template}. Supported placeholders:
 * {@code {{role}}}, {@code {{display_name}}}, {@code {{description}}}, {@code {{data}}},
 * {@code {{upstream}}} and {@code {{omitted}}}.
 *
 * <p>Without a template the prompt is the description followed by each non-empty section.</p>
 */
@Component(TemplatePromptAssembler.NAME)
public class TemplatePromptAssembler implements PromptAssembler {

    public static final String NAME = "template";

    static final String NO_DATA = "(no data provided)";
    static final String NO_UPSTREAM = "(no upstream analyses)";

    @Override
    public String assemble(RoleDefinition role, TaskInput input) {
        String data = input.data() == null || input.data().isEmpty() ? NO_DATA : input.data().render();
        String upstream = input.upstream().isEmpty() ? NO_UPSTREAM : renderUpstream(input.upstream());
        String omitted = renderOmitted(input.omitted());

        String template = role.getPromptTemplate();
        if (template == null || template.isBlank()) {
            return defaultPrompt(role, input, data, upstream, omitted);
        }
        return template
            .replace("{{role}}", role.getRole())
            .replace("{{display_name}}", role.getDisplayName())
            .replace("{{description}}", role.getDescription() != null ? role.getDescription() : "")
            .replace("{{data}}", data)
            .replace("{{upstream}}", upstream)
            .replace("{{omitted}}", omitted)
            .trim();
    }

    private String defaultPrompt(RoleDefinition role, TaskInput input, String data, String upstream, String omitted) {
        StringBuilder prompt = new StringBuilder();
        if (role.getDescription() != null) {
            prompt.append(role.getDescription()).append("\n\n");
        }
        prompt.append("Data:\n").append(data).append("\n\n");
        if (!input.upstream().isEmpty()) {
            prompt.append("Upstream analyses:\n").append(upstream).append("\n\n");
        }
        if (input.hasOmissions()) {
            prompt.append(omitted).append("\n");
        }
        return prompt.toString().trim();
    }

    static String renderUpstream(Map<String, AgentResult> upstream) {
        StringBuilder sb = new StringBuilder();
        upstream.forEach((role, result) -> {
            sb.append("### ").append(role).append('\n');
            sb.append(result.getSummary() != null ? result.getSummary() : result.getContent()).append("\n\n");
        });
        return sb.toString().trim();
    }

    static String renderOmitted(Map<String, TaskState> omitted) {
        if (omitted.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder("Unavailable analyses (not included): ");
        String sep = "";
        for (Map.Entry<String, TaskState> entry : omitted.entrySet()) {
            sb.append(sep).append(entry.getKey()).append(" (").append(entry.getValue()).append(')');
            sep = ", ";
        }
        return sb.toString();
    }
}
