package com.autonomous.analysis.client;

import com.autonomous.analysis.exception.PermanentInferenceException;
import com.autonomous.analysis.model.InferenceParams;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CliInferenceClientTest {

    private final CliInferenceClient client = new CliInferenceClient("llm-cli", Duration.ofSeconds(5));

    @Test
    void shouldBuildPrintModeCommand() {
        InferenceParams params = InferenceParams.builder()
            .model("sonnet")
            .systemPrompt("You are a policy analyst.")
            .build();

        List<String> command = client.buildCommand("Summarize subsidies", params);

        assertEquals(List.of("llm-cli", "--print", "--model", "sonnet",
            "--system-prompt", "You are a policy analyst.", "Summarize subsidies"), command);
    }

    @Test
    void shouldSkipUnsetOptions() {
        List<String> command = client.buildCommand("Summarize subsidies", InferenceParams.builder().build());

        assertEquals(List.of("llm-cli", "--print", "Summarize subsidies"), command);
    }

    @Test
    void shouldFailPermanentlyWhenExecutableIsMissing() {
        CliInferenceClient missing = new CliInferenceClient("/nonexistent/llm-cli-binary", Duration.ofSeconds(5));

        assertThrows(PermanentInferenceException.class,
            () -> missing.infer("policy", "Summarize subsidies", InferenceParams.builder().build()));
    }

    @Test
    void shouldEstimateTokensFromLength() {
        assertEquals(0, CliInferenceClient.estimateTokens(""));
        assertEquals(1, CliInferenceClient.estimateTokens("abcd"));
        assertEquals(3, CliInferenceClient.estimateTokens("abcdefghij"));
    }
}
