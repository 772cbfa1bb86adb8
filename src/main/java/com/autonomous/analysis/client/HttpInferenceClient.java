package com.autonomous.analysis.client;

import com.autonomous.analysis.exception.PermanentInferenceException;
import com.autonomous.analysis.exception.TransientInferenceException;
import com.autonomous.analysis.model.InferenceParams;
import com.autonomous.analysis.model.InferenceResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.ArrayList;
import java.util.List;

/**
 * Client for OpenAI-compatible {@code /chat/completions} endpoints.
 */
@Slf4j
public class HttpInferenceClient implements InferenceClient {

    private final RestClient restClient;
    private final String apiKey;

    public HttpInferenceClient(RestClient restClient, String apiKey) {
        this.restClient = restClient;
        this.apiKey = apiKey;
    }

    @Override
    public InferenceResponse infer(String role, String prompt, InferenceParams params) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new PermanentInferenceException("No inference API key configured (analysis.inference.api-key)");
        }

        List<ChatMessage> messages = new ArrayList<>();
        if (params.getSystemPrompt() != null && !params.getSystemPrompt().isBlank()) {
            messages.add(ChatMessage.system(params.getSystemPrompt()));
        }
        messages.add(ChatMessage.user(prompt));
        ChatCompletionRequest request =
            new ChatCompletionRequest(params.getModel(), messages, params.getTemperature(), params.getMaxTokens());

        ChatCompletionResponse response;
        try {
            response = restClient.post()
                .uri("/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(ChatCompletionResponse.class);
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            String message = "Inference for role '" + role + "' returned HTTP " + status;
            if (isTransientStatus(status)) {
                throw new TransientInferenceException(message, e);
            }
            throw new PermanentInferenceException(message + ": " + e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            throw new TransientInferenceException("Inference backend unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new PermanentInferenceException("Unreadable inference response: " + e.getMessage(), e);
        }

        if (response == null || response.firstContent() == null) {
            throw new TransientInferenceException("Inference for role '" + role + "' returned no choices");
        }
        InferenceResponse.InferenceResponseBuilder result = InferenceResponse.builder()
            .text(response.firstContent())
            .model(response.model() != null ? response.model() : params.getModel());
        if (response.usage() != null) {
            result.inputTokens(response.usage().promptTokens())
                .outputTokens(response.usage().completionTokens());
        }
        log.debug("Role {}: {} chars from {}", role, response.firstContent().length(), response.model());
        return result.build();
    }

    static boolean isTransientStatus(int status) {
        return status == 408 || status == 425 || status == 429 || status >= 500;
    }
}
