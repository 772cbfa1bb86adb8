package com.autonomous.analysis.service;

import com.autonomous.analysis.config.AnalysisProperties;
import com.autonomous.analysis.model.FailureRecord;
import com.autonomous.analysis.model.RunSummary;
import com.slack.api.Slack;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.response.chat.ChatPostMessageResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
public class SlackNotificationService {

    static final int MAX_FAILURES_LISTED = 5;

    private final AnalysisProperties.Slack settings;
    private final Slack slack;

    @Autowired
    public SlackNotificationService(AnalysisProperties properties) {
        this(properties, Slack.getInstance());
    }

    SlackNotificationService(AnalysisProperties properties, Slack slack) {
        this.settings = properties.getSlack();
        this.slack = slack;
    }

    public boolean isEnabled() {
        return settings.isConfigured();
    }

    /**
     * @return the message timestamp that anchors the run's thread, or null when nothing was posted
     */
    public String postRunStarted(String runId, List<String> roles) {
        if (!isEnabled()) {
            return null;
        }
        String message = String.format("*Industry analysis %s started*\nRoles: %s", runId, String.join(", ", roles));
        return post(message, null);
    }

    public void postRunFinished(RunSummary summary, String threadTs) {
        if (!isEnabled()) {
            return;
        }
        post(formatOutcome(summary), threadTs);
    }

    String formatOutcome(RunSummary summary) {
        StringBuilder message = new StringBuilder();
        message.append("*Analysis ").append(summary.getRunId()).append(": ").append(summary.getStatus()).append("*\n\n");
        message.append("*Results:* ").append(summary.getResults().size())
            .append(" of ").append(summary.getSelectedRoles().size()).append(" roles\n");
        message.append("*Report:* ").append(summary.getReport() != null ? "generated" : "not generated").append('\n');
        message.append("*Tokens:* ").append(summary.getTotalInputTokens() + summary.getTotalOutputTokens()).append('\n');

        List<FailureRecord> failures = summary.getFailures();
        if (!failures.isEmpty()) {
            message.append("\n*Failures:*\n");
            failures.stream().limit(MAX_FAILURES_LISTED).forEach(f -> message.append("• ")
                .append(f.getRole()).append(" (").append(f.getErrorClass()).append("): ")
                .append(f.getMessage()).append('\n'));
            if (failures.size() > MAX_FAILURES_LISTED) {
                message.append("• ... ").append(failures.size() - MAX_FAILURES_LISTED).append(" more\n");
            }
        }
        return message.toString();
    }

    private String post(String text, String threadTs) {
        try {
            MethodsClient methods = slack.methods(settings.getBotToken());

            ChatPostMessageRequest request = ChatPostMessageRequest.builder()
                .channel(settings.getChannel())
                .threadTs(threadTs)
                .text(text)
                .build();

            ChatPostMessageResponse response = methods.chatPostMessage(request);

            if (response.isOk()) {
                return response.getTs();
            }
            log.warn("Failed to post Slack message: {}", response.getError());
            return null;
        } catch (Exception e) {
            log.warn("Failed to post Slack message: {}", e.getMessage());
            return null;
        }
    }
}
