package com.autonomous.analysis.service;

import com.autonomous.analysis.config.AnalysisProperties;
import com.autonomous.analysis.model.ErrorClass;
import com.autonomous.analysis.model.FailureRecord;
import com.autonomous.analysis.model.RunStatus;
import com.autonomous.analysis.model.RunSummary;
import com.slack.api.Slack;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.response.chat.ChatPostMessageResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SlackNotificationServiceTest {

    private Slack slack;
    private MethodsClient methods;
    private AnalysisProperties properties;

    @BeforeEach
    void setUp() {
        slack = mock(Slack.class);
        methods = mock(MethodsClient.class);
        when(slack.methods("xoxb-test")).thenReturn(methods);
        properties = new AnalysisProperties();
        properties.getSlack().setBotToken("xoxb-test");
        properties.getSlack().setChannel("C123");
    }

    private static RunSummary summary(List<FailureRecord> failures) {
        return RunSummary.builder()
            .runId("run-1")
            .status(RunStatus.COMPLETED_WITH_ERRORS)
            .selectedRoles(List.of("macro", "finance"))
            .results(List.of())
            .failures(failures)
            .roleStatuses(List.of())
            .totalInputTokens(1200)
            .totalOutputTokens(300)
            .build();
    }

    @Test
    void shouldPostStartAndReplyInThread() throws Exception {
        ChatPostMessageResponse ok = new ChatPostMessageResponse();
        ok.setOk(true);
        ok.setTs("1700000000.000100");
        when(methods.chatPostMessage(any(ChatPostMessageRequest.class))).thenReturn(ok);
        SlackNotificationService notifier = new SlackNotificationService(properties, slack);

        String threadTs = notifier.postRunStarted("run-1", List.of("macro", "finance"));
        notifier.postRunFinished(summary(List.of()), threadTs);

        ArgumentCaptor<ChatPostMessageRequest> requests = ArgumentCaptor.forClass(ChatPostMessageRequest.class);
        verify(methods, times(2)).chatPostMessage(requests.capture());
        assertEquals("1700000000.000100", threadTs);
        assertEquals("C123", requests.getAllValues().get(0).getChannel());
        assertTrue(requests.getAllValues().get(0).getText().contains("Roles: macro, finance"));
        assertEquals(threadTs, requests.getAllValues().get(1).getThreadTs());
    }

    @Test
    void shouldDoNothingWhenNotConfigured() {
        properties.getSlack().setBotToken("");
        SlackNotificationService notifier = new SlackNotificationService(properties, slack);

        assertFalse(notifier.isEnabled());
        assertNull(notifier.postRunStarted("run-1", List.of("macro")));
        verifyNoInteractions(slack);
    }

    @Test
    void shouldSwallowSlackErrors() throws Exception {
        when(methods.chatPostMessage(any(ChatPostMessageRequest.class))).thenThrow(new IOException("network down"));
        SlackNotificationService notifier = new SlackNotificationService(properties, slack);

        assertNull(notifier.postRunStarted("run-1", List.of("macro")));
    }

    @Test
    void shouldListAtMostFiveFailures() {
        List<FailureRecord> failures = new ArrayList<>();
        for (int i = 1; i <= 7; i++) {
            failures.add(FailureRecord.builder()
                .role("role" + i).attempt(1).errorClass(ErrorClass.TRANSIENT_INFERENCE).message("timeout").build());
        }
        SlackNotificationService notifier = new SlackNotificationService(properties, slack);

        String message = notifier.formatOutcome(summary(failures));

        assertTrue(message.startsWith("*Analysis run-1: COMPLETED_WITH_ERRORS*"));
        assertTrue(message.contains("*Results:* 0 of 2 roles"));
        assertTrue(message.contains("*Report:* not generated"));
        assertTrue(message.contains("*Tokens:* 1500"));
        assertTrue(message.contains("role5 (TRANSIENT_INFERENCE): timeout"));
        assertFalse(message.contains("role6"));
        assertTrue(message.contains("... 2 more"));
    }
}
