package com.autonomous.analysis.config;

import com.autonomous.analysis.client.CliInferenceClient;
import com.autonomous.analysis.client.HttpInferenceClient;
import com.autonomous.analysis.client.InferenceClient;
import com.autonomous.analysis.exception.ConfigurationException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class ClientConfig {

    @Bean
    RestClient inferenceRestClient(AnalysisProperties properties) {
        return RestClient.builder()
            .baseUrl(properties.getInference().getBaseUrl())
            .build();
    }

    @Bean
    InferenceClient inferenceClient(AnalysisProperties properties, RestClient inferenceRestClient) {
        AnalysisProperties.Inference inference = properties.getInference();
        return switch (inference.getProvider().toLowerCase()) {
            case "http" -> new HttpInferenceClient(inferenceRestClient, inference.getApiKey());
            case "cli" -> new CliInferenceClient(inference.getCliPath(), properties.getRun().getTaskTimeout());
            default -> throw new ConfigurationException("Unknown inference provider: " + inference.getProvider());
        };
    }
}
