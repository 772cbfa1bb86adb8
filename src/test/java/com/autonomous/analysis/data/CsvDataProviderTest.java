package com.autonomous.analysis.data;

import com.autonomous.analysis.exception.DataNotFoundException;
import com.autonomous.analysis.model.DataPayload;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CsvDataProviderTest {

    @TempDir
    Path tempDir;

    private CsvDataProvider provider(int maxLength, Map<String, List<String>> files) {
        return new CsvDataProvider(tempDir, maxLength, role -> files.getOrDefault(role, List.of()));
    }

    @Test
    void shouldSummarizeShapeColumnsAndNumericStats() throws IOException {
        Files.writeString(tempDir.resolve("gdp.csv"), """
            year,region,gdp
            2021,east,100
            2022,east,110
            2023,west,120
            """);

        DataPayload payload = provider(2000, Map.of("macro", List.of("gdp.csv"))).loadInput("macro");

        String summary = payload.getSummaries().get("gdp.csv");
        assertTrue(summary.startsWith("Shape: (3, 3)"));
        assertTrue(summary.contains("Columns: year, region, gdp"));
        assertTrue(summary.contains("- gdp: mean=110.00, std=10.00, min=100.00, max=120.00"));
        assertTrue(summary.contains("- year: mean=2022.00"));
        assertFalse(summary.contains("- region"));
    }

    @Test
    void shouldKeepFileOrderAcrossSources() throws IOException {
        Files.writeString(tempDir.resolve("a.csv"), "x\n1\n");
        Files.writeString(tempDir.resolve("b.csv"), "y\n2\n");

        DataPayload payload = provider(2000, Map.of("finance", List.of("b.csv", "a.csv"))).loadInput("finance");

        assertEquals(List.of("b.csv", "a.csv"), List.copyOf(payload.getSummaries().keySet()));
        assertTrue(payload.render().startsWith("Source: b.csv"));
    }

    @Test
    void shouldReturnEmptyPayloadForRoleWithoutData() {
        DataPayload payload = provider(2000, Map.of()).loadInput("report");

        assertTrue(payload.isEmpty());
        assertEquals("report", payload.getRole());
    }

    @Test
    void shouldFailOnMissingFile() {
        CsvDataProvider provider = provider(2000, Map.of("market", List.of("missing.csv")));

        DataNotFoundException e = assertThrows(DataNotFoundException.class, () -> provider.loadInput("market"));
        assertTrue(e.getMessage().contains("missing.csv"));
    }

    @Test
    void shouldTruncateLongSummaries() throws IOException {
        StringBuilder header = new StringBuilder();
        StringBuilder row = new StringBuilder();
        for (int i = 0; i < 12; i++) {
            header.append(i == 0 ? "" : ",").append("column_").append(i);
            row.append(i == 0 ? "" : ",").append(i);
        }
        Files.writeString(tempDir.resolve("wide.csv"), header + "\n" + row + "\n");

        String full = provider(5000, Map.of("policy", List.of("wide.csv"))).loadInput("policy")
            .getSummaries().get("wide.csv");
        String truncated = provider(40, Map.of("policy", List.of("wide.csv"))).loadInput("policy")
            .getSummaries().get("wide.csv");

        assertTrue(full.contains("... (12 columns)"));
        assertFalse(full.contains("column_10"));
        assertEquals(43, truncated.length());
        assertTrue(truncated.endsWith("..."));
    }
}
