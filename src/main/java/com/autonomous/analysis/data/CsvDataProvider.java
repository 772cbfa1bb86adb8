package com.autonomous.analysis.data;

import com.autonomous.analysis.exception.DataNotFoundException;
import com.autonomous.analysis.model.DataPayload;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

@Slf4j
public class CsvDataProvider implements RawDataProvider {

    static final int MAX_COLUMNS_LISTED = 10;
    static final int MAX_NUMERIC_COLUMNS = 5;

    private final Path dataRoot;
    private final int summaryMaxLength;
    private final Function<String, List<String>> dataFilesOf;
    private final CsvMapper csvMapper;

    public CsvDataProvider(Path dataRoot, int summaryMaxLength, Function<String, List<String>> dataFilesOf) {
        this.dataRoot = dataRoot;
        this.summaryMaxLength = summaryMaxLength;
        this.dataFilesOf = dataFilesOf;
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.TRIM_SPACES);
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    @Override
    public DataPayload loadInput(String role) {
        List<String> files = dataFilesOf.apply(role);
        if (files == null || files.isEmpty()) {
            return DataPayload.empty(role);
        }
        Map<String, String> summaries = new LinkedHashMap<>();
        for (String file : files) {
            summaries.put(file, summarize(readTable(file)));
        }
        log.debug("Loaded {} data file(s) for role {}", summaries.size(), role);
        return DataPayload.of(role, summaries);
    }

    Table readTable(String fileName) {
        Path file = dataRoot.resolve(fileName);
        if (!Files.isRegularFile(file)) {
            throw new DataNotFoundException("Data file not found: " + file);
        }
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> rows =
                 csvMapper.readerFor(Map.class).with(schema).readValues(file.toFile())) {
            List<Map<String, String>> records = rows.readAll();
            List<String> columns = new ArrayList<>();
            CsvSchema parsed = (CsvSchema) rows.getParserSchema();
            if (parsed != null) {
                parsed.forEach(column -> columns.add(column.getName()));
            } else if (!records.isEmpty()) {
                columns.addAll(records.get(0).keySet());
            }
            return new Table(columns, records);
        } catch (IOException e) {
            throw new DataNotFoundException("Could not read data file " + file + ": " + e.getMessage(), e);
        }
    }

    String summarize(Table table) {
        StringBuilder summary = new StringBuilder();
        summary.append("Shape: (").append(table.rows().size()).append(", ").append(table.columns().size()).append(")\n");

        List<String> columns = table.columns();
        String listed = String.join(", ", columns.subList(0, Math.min(MAX_COLUMNS_LISTED, columns.size())));
        if (columns.size() > MAX_COLUMNS_LISTED) {
            listed += "... (" + columns.size() + " columns)";
        }
        summary.append("Columns: ").append(listed).append('\n');

        Map<String, ColumnStats> numeric = numericColumns(table);
        if (!numeric.isEmpty()) {
            summary.append("\nNumeric summary:\n");
            numeric.forEach((column, stats) -> summary.append(String.format(
                "- %s: mean=%.2f, std=%.2f, min=%.2f, max=%.2f\n",
                column, stats.mean(), stats.std(), stats.min(), stats.max())));
        }

        String text = summary.toString();
        if (text.length() > summaryMaxLength) {
            text = text.substring(0, summaryMaxLength) + "...";
        }
        return text;
    }

    // First MAX_NUMERIC_COLUMNS columns whose non-blank cells all parse as numbers.
    private Map<String, ColumnStats> numericColumns(Table table) {
        Map<String, ColumnStats> numeric = new LinkedHashMap<>();
        for (String column : table.columns()) {
            if (numeric.size() >= MAX_NUMERIC_COLUMNS) {
                break;
            }
            List<Double> values = new ArrayList<>();
            boolean isNumeric = true;
            for (Map<String, String> row : table.rows()) {
                String cell = row.get(column);
                if (cell == null || cell.isBlank()) {
                    continue;
                }
                try {
                    values.add(Double.parseDouble(cell.replace(",", "")));
                } catch (NumberFormatException e) {
                    isNumeric = false;
                    break;
                }
            }
            if (isNumeric && !values.isEmpty()) {
                numeric.put(column, ColumnStats.of(values));
            }
        }
        return numeric;
    }

    record Table(List<String> columns, List<Map<String, String>> rows) {
    }

    record ColumnStats(double mean, double std, double min, double max) {

        // Sample standard deviation, 0 for a single value.
        static ColumnStats of(List<Double> values) {
            double sum = 0;
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double value : values) {
                sum += value;
                min = Math.min(min, value);
                max = Math.max(max, value);
            }
            double mean = sum / values.size();
            double squares = 0;
            for (double value : values) {
                squares += (value - mean) * (value - mean);
            }
            double std = values.size() > 1 ? Math.sqrt(squares / (values.size() - 1)) : 0.0;
            return new ColumnStats(mean, std, min, max);
        }
    }
}
