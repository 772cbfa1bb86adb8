package com.autonomous.analysis.sink;

import com.autonomous.analysis.model.AgentResult;
import com.autonomous.analysis.model.RunSummary;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Function;

@Slf4j
public class FileArtifactSink implements ArtifactSink {

    public static final String RUN_SUMMARY_FILE = "run_summary.json";
    public static final String REPORT_MARKDOWN_FILE = "report.md";
    public static final String REPORT_JSON_FILE = "report.json";
    public static final String ANALYSIS_SUMMARY_FILE = "analysis_summary.md";

    private final Path outputRoot;
    private final Function<String, String> displayNameOf;
    private final InsightExtractor insightExtractor;
    private final ObjectMapper mapper;

    public FileArtifactSink(Path outputRoot, Function<String, String> displayNameOf, InsightExtractor insightExtractor) {
        this.outputRoot = outputRoot;
        this.displayNameOf = displayNameOf;
        this.insightExtractor = insightExtractor;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path runDirectory(String runId) {
        return outputRoot.resolve(runId);
    }

    public static String resultFileName(String role) {
        return role + "_result.json";
    }

    @Override
    public void emit(RunSummary summary) {
        Path dir = runDirectory(summary.getRunId());
        try {
            Files.createDirectories(dir);
            for (AgentResult result : summary.getResults()) {
                mapper.writeValue(dir.resolve(resultFileName(result.getRole())).toFile(), result);
            }
            if (summary.getReport() != null) {
                Files.writeString(dir.resolve(REPORT_MARKDOWN_FILE), summary.getReport().getContent(), StandardCharsets.UTF_8);
                mapper.writeValue(dir.resolve(REPORT_JSON_FILE).toFile(), summary.getReport());
            }
            Files.writeString(dir.resolve(ANALYSIS_SUMMARY_FILE), renderInsights(summary), StandardCharsets.UTF_8);
            mapper.writeValue(dir.resolve(RUN_SUMMARY_FILE).toFile(), summary);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write artifacts of run " + summary.getRunId() + " to " + dir, e);
        }
        log.info("Run {}: artifacts written to {}", summary.getRunId(), dir);
    }

    String renderInsights(RunSummary summary) {
        StringBuilder md = new StringBuilder();
        md.append("# Industry Analysis Summary\n\n");
        md.append("Run: ").append(summary.getRunId()).append(" (").append(summary.getStatus()).append(")\n\n");
        for (AgentResult result : summary.getResults()) {
            List<String> insights = insightExtractor.extract(result);
            if (insights.isEmpty()) {
                continue;
            }
            md.append("## ").append(displayNameOf.apply(result.getRole())).append("\n\n");
            insights.forEach(insight -> md.append("- ").append(insight).append('\n'));
            md.append('\n');
        }
        if (!summary.getFailures().isEmpty()) {
            md.append("## Failures\n\n");
            summary.getFailures().forEach(f -> md.append(String.format("- %s (attempt %d, %s): %s\n",
                f.getRole(), f.getAttempt(), f.getErrorClass(), f.getMessage())));
        }
        return md.toString();
    }
}
