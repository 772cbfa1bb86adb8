package com.autonomous.analysis.service;

import com.autonomous.analysis.config.AnalysisProperties;
import com.autonomous.analysis.model.AgentResult;
import com.autonomous.analysis.model.ReportArtifact;
import com.autonomous.analysis.model.RunSummary;
import com.autonomous.analysis.model.UsageEntry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

@Slf4j
@Service
public class UsageTrackerService {

    static final String USAGE_FILE = "usage.jsonl";
    static final double WARNING_THRESHOLD_PERCENT = 80.0;

    private final ObjectMapper mapper;
    private final List<UsageEntry> currentMonthUsage = Collections.synchronizedList(new ArrayList<>());

    private String dataPath;
    private long monthlyTokenBudget;

    public UsageTrackerService(AnalysisProperties properties) {
        this.dataPath = properties.getUsage().getDataPath();
        this.monthlyTokenBudget = properties.getUsage().getMonthlyTokenBudget();
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
    }

    public void setDataPath(String path) {
        this.dataPath = path;
    }

    public void setMonthlyTokenBudget(long budget) {
        this.monthlyTokenBudget = budget;
    }

    @PostConstruct
    public void init() {
        loadCurrentMonthUsage();
    }

    public List<UsageEntry> recordRun(RunSummary summary) {
        List<UsageEntry> recorded = new ArrayList<>();
        for (AgentResult result : summary.getResults()) {
            recorded.add(record(summary.getRunId(), result.getRole(), result.getModel(),
                result.getInputTokens(), result.getOutputTokens(), result.getLatencyMillis()));
        }
        ReportArtifact report = summary.getReport();
        if (report != null) {
            recorded.add(record(summary.getRunId(), report.getRole(), report.getModel(),
                report.getInputTokens(), report.getOutputTokens(), report.getLatencyMillis()));
        }
        if (isOverBudgetThreshold()) {
            log.warn("Token usage at {}% of the monthly budget", String.format("%.0f", getBudgetPercentage()));
        }
        return recorded;
    }

    public UsageEntry record(String runId, String role, String model, long inputTokens, long outputTokens, long latencyMillis) {
        UsageEntry entry = UsageEntry.builder()
            .timestamp(Instant.now())
            .runId(runId)
            .role(role)
            .model(model)
            .inputTokens(inputTokens)
            .outputTokens(outputTokens)
            .latencyMillis(latencyMillis)
            .build();

        currentMonthUsage.add(entry);
        persistEntry(entry);
        return entry;
    }

    public long getMonthlyTokens() {
        synchronized (currentMonthUsage) {
            return currentMonthUsage.stream()
                .mapToLong(e -> e.getInputTokens() + e.getOutputTokens())
                .sum();
        }
    }

    public double getBudgetPercentage() {
        if (monthlyTokenBudget <= 0) {
            return 0.0;
        }
        return (getMonthlyTokens() * 100.0) / monthlyTokenBudget;
    }

    public boolean isOverBudgetThreshold() {
        return getBudgetPercentage() >= WARNING_THRESHOLD_PERCENT;
    }

    public String formatBudgetStatus() {
        return String.format("%dK / %dK tokens (%.0f%%)",
            getMonthlyTokens() / 1000,
            monthlyTokenBudget / 1000,
            getBudgetPercentage());
    }

    public Map<String, Object> usageReport() {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("month", YearMonth.now(ZoneOffset.UTC).toString());
        report.put("tokens", getMonthlyTokens());
        report.put("budget", monthlyTokenBudget);
        report.put("percentage", getBudgetPercentage());
        report.put("warning", isOverBudgetThreshold());
        report.put("status", formatBudgetStatus());
        return report;
    }

    private void persistEntry(UsageEntry entry) {
        try {
            Path usageFile = Paths.get(dataPath, USAGE_FILE);
            Files.createDirectories(usageFile.getParent());

            String json = mapper.writeValueAsString(entry);
            Files.writeString(usageFile, json + "\n",
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            log.error("Failed to persist usage entry: {}", e.getMessage());
        }
    }

    private void loadCurrentMonthUsage() {
        currentMonthUsage.clear();
        Path usageFile = Paths.get(dataPath, USAGE_FILE);
        if (!Files.exists(usageFile)) {
            return;
        }
        YearMonth currentMonth = YearMonth.now(ZoneOffset.UTC);
        try (Stream<String> lines = Files.lines(usageFile)) {
            lines.filter(line -> !line.isBlank()).forEach(line -> {
                try {
                    UsageEntry entry = mapper.readValue(line, UsageEntry.class);
                    YearMonth entryMonth = YearMonth.from(entry.getTimestamp().atZone(ZoneOffset.UTC));
                    if (entryMonth.equals(currentMonth)) {
                        currentMonthUsage.add(entry);
                    }
                } catch (Exception e) {
                    log.debug("Skipping malformed usage entry: {}", e.getMessage());
                }
            });
        } catch (IOException e) {
            log.error("Failed to load usage: {}", e.getMessage());
        }
    }
}
