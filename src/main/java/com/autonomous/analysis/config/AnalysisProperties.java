package com.autonomous.analysis.config;

import com.autonomous.analysis.model.InferenceParams;
import com.autonomous.analysis.model.RunOptions;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "analysis")
public class AnalysisProperties {

    private String rolesPath = "config/roles";
    private String synthesisRole = "report";

    private InputData data = new InputData();
    private Output output = new Output();
    private Inference inference = new Inference();
    private Run run = new Run();
    private Usage usage = new Usage();
    private Slack slack = new Slack();
    private Cli cli = new Cli();

    @Data
    public static class InputData {
        private String root = "data";
        private int summaryMaxLength = 500;
    }

    @Data
    public static class Output {
        private String path = "output";
    }

    @Data
    public static class Inference {
        /** {@code http} for an OpenAI-compatible endpoint, {@code cli} for a local command-line tool. */
        private String provider = "http";
        private String baseUrl = "https://api.siliconflow.cn/v1";
        private String apiKey;
        private String model = "deepseek-ai/DeepSeek-V3";
        private double temperature = 0.1;
        private int maxTokens = 4000;
        private String cliPath = "claude";

        public InferenceParams toParams() {
            return InferenceParams.builder()
                .model(model)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .build();
        }
    }

    @Data
    public static class Run {
        private int maxConcurrent = 3;
        private int maxRetries = 2;
        private Duration taskTimeout = Duration.ofSeconds(120);
        private Duration baseDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private boolean jitter = true;
        private boolean enableCharts = true;

        public RunOptions toOptions() {
            return RunOptions.builder()
                .maxConcurrent(maxConcurrent)
                .maxRetries(maxRetries)
                .taskTimeout(taskTimeout)
                .baseDelay(baseDelay)
                .maxDelay(maxDelay)
                .jitter(jitter)
                .enableCharts(enableCharts)
                .build();
        }
    }

    @Data
    public static class Usage {
        private String dataPath = "data";
        private long monthlyTokenBudget = 5_000_000L;
    }

    @Data
    public static class Slack {
        private String botToken;
        private String channel;

        public boolean isConfigured() {
            return botToken != null && !botToken.isBlank() && channel != null && !channel.isBlank();
        }
    }

    @Data
    public static class Cli {
        private boolean enabled = false;
    }
}
