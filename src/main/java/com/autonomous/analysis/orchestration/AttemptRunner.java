package com.autonomous.analysis.orchestration;

import com.autonomous.analysis.client.InferenceClient;
import com.autonomous.analysis.exception.TransientInferenceException;
import com.autonomous.analysis.model.AgentResult;
import com.autonomous.analysis.model.InferenceParams;
import com.autonomous.analysis.model.InferenceResponse;
import com.autonomous.analysis.model.TaskInput;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes a single attempt of a role: prompt assembly, the inference call bounded by the
 * attempt timeout, and result parsing. A timed-out call is abandoned and its late reply dropped.
 */
@Slf4j
public class AttemptRunner {

    private final InferenceClient inferenceClient;
    private final ResultParser resultParser;
    private final ExecutorService callExecutor;
    private final Duration timeout;

    public AttemptRunner(InferenceClient inferenceClient, ResultParser resultParser,
                         ExecutorService callExecutor, Duration timeout) {
        this.inferenceClient = inferenceClient;
        this.resultParser = resultParser;
        this.callExecutor = callExecutor;
        this.timeout = timeout;
    }

    public AgentResult run(AgentDefinition agent, TaskInput input, InferenceParams defaults, int attempt) {
        String role = agent.role();
        String prompt = agent.prompt(input);
        InferenceParams params = agent.params(defaults);
        log.debug("Role {} attempt {}: prompt of {} chars", role, attempt, prompt.length());

        long started = System.nanoTime();
        Future<InferenceResponse> call = callExecutor.submit(() -> inferenceClient.infer(role, prompt, params));
        InferenceResponse response;
        try {
            response = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new TransientInferenceException(
                "Inference for role '" + role + "' timed out after " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransientInferenceException("Inference for role '" + role + "' was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new TransientInferenceException(
                "Inference for role '" + role + "' failed: " + cause.getMessage(), cause);
        }
        long latencyMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        String text = response == null || response.getText() == null ? "" : response.getText();
        if (text.isBlank()) {
            throw new TransientInferenceException("Inference for role '" + role + "' returned an empty reply");
        }
        String summaryField = agent.definition().getSummaryField();
        Map<String, Object> fields = resultParser.parseFields(text, summaryField);

        return AgentResult.builder()
            .role(role)
            .content(text)
            .fields(fields)
            .summary(resultParser.summaryOf(fields, summaryField, text))
            .timestamp(Instant.now())
            .model(response.getModel() != null ? response.getModel() : params.getModel())
            .attempt(attempt)
            .latencyMillis(latencyMillis)
            .inputTokens(response.getInputTokens())
            .outputTokens(response.getOutputTokens())
            .build();
    }
}
