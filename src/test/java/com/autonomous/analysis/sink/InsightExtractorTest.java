package com.autonomous.analysis.sink;

import com.autonomous.analysis.model.AgentResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InsightExtractorTest {

    private final InsightExtractor extractor = new InsightExtractor();

    @Test
    void shouldPreferListedKeyInsights() {
        AgentResult result = AgentResult.builder()
            .role("market")
            .field("key_insights", List.of("EV sales up 30%", " ", "Charging network doubled"))
            .summary("Ignored summary sentence that is long enough.")
            .build();

        assertEquals(List.of("EV sales up 30%", "Charging network doubled"), extractor.extract(result));
    }

    @Test
    void shouldCapListedInsights() {
        AgentResult result = AgentResult.builder()
            .role("market")
            .field("key_insights", List.of("one", "two", "three", "four", "five", "six", "seven"))
            .build();

        assertEquals(5, extractor.extract(result).size());
    }

    @Test
    void shouldFallBackToLeadingSentencesOfSummary() {
        AgentResult result = AgentResult.builder()
            .role("macro")
            .summary("GDP growth stabilized at 5%. Short. Inflation remains below target! Exports slowed in Q3.")
            .build();

        assertEquals(List.of("GDP growth stabilized at 5%.", "Inflation remains below target!"),
            extractor.extract(result));
    }

    @Test
    void shouldSplitOnFullWidthPunctuation() {
        List<String> sentences = InsightExtractor.leadingSentences("新能源汽车销量同比增长百分之三十以上。充电桩数量翻倍增长并覆盖主要城市。");

        assertEquals(2, sentences.size());
    }

    @Test
    void shouldReturnNothingWithoutSummaryOrInsights() {
        AgentResult result = AgentResult.builder().role("policy").content("raw").build();

        assertTrue(extractor.extract(result).isEmpty());
    }
}
