package com.autonomous.analysis.orchestration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads a model reply as a JSON object when it is one (optionally inside a markdown code fence),
 * otherwise keeps the text under the role's summary field.
 */
@Slf4j
public class ResultParser {

    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ResultParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<String, Object> parseFields(String text, String summaryField) {
        String body = stripFence(text);
        if (body.startsWith("{")) {
            try {
                return objectMapper.readValue(body, FIELDS);
            } catch (JsonProcessingException e) {
                log.debug("Reply is not a JSON object, keeping raw text: {}", e.getOriginalMessage());
            }
        }
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(summaryField, text == null ? "" : text.trim());
        return fields;
    }

    public String summaryOf(Map<String, Object> fields, String summaryField, String fallback) {
        Object value = fields.get(summaryField);
        if (value instanceof String s && !s.isBlank()) {
            return s;
        }
        Object generic = fields.get("summary");
        if (generic instanceof String s && !s.isBlank()) {
            return s;
        }
        return fallback == null ? "" : fallback.trim();
    }

    static String stripFence(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int closing = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && closing > firstNewline) {
                return trimmed.substring(firstNewline + 1, closing).trim();
            }
        }
        return trimmed;
    }
}
