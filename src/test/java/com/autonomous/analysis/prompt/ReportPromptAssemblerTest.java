package com.autonomous.analysis.prompt;

import com.autonomous.analysis.model.AgentResult;
import com.autonomous.analysis.model.DataPayload;
import com.autonomous.analysis.model.RoleDefinition;
import com.autonomous.analysis.model.TaskInput;
import com.autonomous.analysis.model.TaskState;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReportPromptAssemblerTest {

    private final ReportPromptAssembler assembler = new ReportPromptAssembler(new TemplatePromptAssembler());

    private static RoleDefinition reportRole(String template) {
        RoleDefinition role = new RoleDefinition();
        role.setRole("report");
        role.setSynthesis(true);
        role.setPromptTemplate(template);
        return role;
    }

    @Test
    void shouldListSucceededAnalysesInOrderAndNameOmissions() {
        Map<String, AgentResult> upstream = new LinkedHashMap<>();
        upstream.put("finance", AgentResult.builder().role("finance").summary("Healthy balance sheets.").build());
        upstream.put("market", AgentResult.builder().role("market").summary("Demand is rising.").build());
        Map<String, TaskState> omitted = new LinkedHashMap<>();
        omitted.put("macro", TaskState.FAILED);
        omitted.put("forecast", TaskState.SKIPPED);
        TaskInput input = new TaskInput("report", DataPayload.empty("report"), upstream, omitted);

        String prompt = assembler.assemble(reportRole("Respond in JSON with a report_content field."), input);

        assertTrue(prompt.contains("## finance\nHealthy balance sheets."));
        assertTrue(prompt.indexOf("## finance") < prompt.indexOf("## market"));
        assertTrue(prompt.contains("Unavailable analyses (not included): macro (FAILED), forecast (SKIPPED)."
            + " Do not invent findings for them."));
        assertTrue(prompt.endsWith("Respond in JSON with a report_content field."));
        assertFalse(prompt.contains("## macro"));
    }

    @Test
    void shouldOmitNoteWhenEverythingSucceeded() {
        TaskInput input = new TaskInput("report", DataPayload.empty("report"),
            Map.of("policy", AgentResult.builder().role("policy").content("Subsidies extended.").build()), Map.of());

        String prompt = assembler.assemble(reportRole(null), input);

        assertTrue(prompt.endsWith("## policy\nSubsidies extended."));
        assertFalse(prompt.contains("Unavailable"));
    }
}
