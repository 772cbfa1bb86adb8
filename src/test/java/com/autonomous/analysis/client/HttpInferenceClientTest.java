package com.autonomous.analysis.client;

import com.autonomous.analysis.exception.PermanentInferenceException;
import com.autonomous.analysis.exception.TransientInferenceException;
import com.autonomous.analysis.model.InferenceParams;
import com.autonomous.analysis.model.InferenceResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class HttpInferenceClientTest {

    private static final InferenceParams PARAMS = InferenceParams.builder()
        .model("deepseek-chat")
        .systemPrompt("You are a macroeconomic analyst.")
        .temperature(0.1)
        .maxTokens(4000)
        .build();

    private MockRestServiceServer server;
    private HttpInferenceClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("https://inference.test/v1");
        server = MockRestServiceServer.bindTo(builder).build();
        client = new HttpInferenceClient(builder.build(), "sk-test");
    }

    @Test
    void shouldPostChatCompletionAndReadUsage() {
        server.expect(requestTo("https://inference.test/v1/chat/completions"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header("Authorization", "Bearer sk-test"))
            .andExpect(jsonPath("$.model").value("deepseek-chat"))
            .andExpect(jsonPath("$.max_tokens").value(4000))
            .andExpect(jsonPath("$.messages[0].role").value("system"))
            .andExpect(jsonPath("$.messages[1].content").value("Analyze GDP"))
            .andRespond(withSuccess("""
                {"model": "deepseek-chat",
                 "choices": [{"index": 0, "message": {"role": "assistant", "content": "{\\"summary\\": \\"ok\\"}"}}],
                 "usage": {"prompt_tokens": 120, "completion_tokens": 40, "total_tokens": 160}}
                """, MediaType.APPLICATION_JSON));

        InferenceResponse response = client.infer("macro", "Analyze GDP", PARAMS);

        assertEquals("{\"summary\": \"ok\"}", response.getText());
        assertEquals(120, response.getInputTokens());
        assertEquals(40, response.getOutputTokens());
        server.verify();
    }

    @Test
    void shouldTreatRateLimitAsTransient() {
        server.expect(requestTo("https://inference.test/v1/chat/completions"))
            .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThrows(TransientInferenceException.class, () -> client.infer("macro", "Analyze GDP", PARAMS));
    }

    @Test
    void shouldTreatServerErrorAsTransient() {
        server.expect(requestTo("https://inference.test/v1/chat/completions"))
            .andRespond(withServerError());

        assertThrows(TransientInferenceException.class, () -> client.infer("macro", "Analyze GDP", PARAMS));
    }

    @Test
    void shouldTreatRejectedCredentialsAsPermanent() {
        server.expect(requestTo("https://inference.test/v1/chat/completions"))
            .andRespond(withUnauthorizedRequest().body("{\"error\": \"invalid key\"}"));

        PermanentInferenceException e = assertThrows(PermanentInferenceException.class,
            () -> client.infer("macro", "Analyze GDP", PARAMS));
        assertTrue(e.getMessage().contains("401"));
    }

    @Test
    void shouldTreatConnectionFailureAsTransient() {
        server.expect(requestTo("https://inference.test/v1/chat/completions"))
            .andRespond(withException(new IOException("connection reset")));

        assertThrows(TransientInferenceException.class, () -> client.infer("macro", "Analyze GDP", PARAMS));
    }

    @Test
    void shouldTreatEmptyChoicesAsTransient() {
        server.expect(requestTo("https://inference.test/v1/chat/completions"))
            .andRespond(withSuccess("{\"model\": \"deepseek-chat\", \"choices\": []}", MediaType.APPLICATION_JSON));

        assertThrows(TransientInferenceException.class, () -> client.infer("macro", "Analyze GDP", PARAMS));
    }

    @Test
    void shouldRejectMissingApiKeyWithoutCalling() {
        HttpInferenceClient unconfigured = new HttpInferenceClient(RestClient.create(), " ");

        assertThrows(PermanentInferenceException.class, () -> unconfigured.infer("macro", "Analyze GDP", PARAMS));
    }

    @Test
    void shouldClassifyStatuses() {
        assertTrue(HttpInferenceClient.isTransientStatus(408));
        assertTrue(HttpInferenceClient.isTransientStatus(503));
        assertFalse(HttpInferenceClient.isTransientStatus(400));
        assertFalse(HttpInferenceClient.isTransientStatus(403));
    }
}
