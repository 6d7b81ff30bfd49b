package com.devflow.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

import java.util.Optional;

/**
 * Lenient JSON extraction from model output.
 * <p>
 * Accepts bare JSON, JSON wrapped in markdown code fences, and JSON embedded in prose
 * (the outermost {@code {...}} span is used).
 */
public class LlmJsonParser {

    private final ObjectMapper mapper;

    public LlmJsonParser() {
        this.mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true);
        mapper.configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
        mapper.configure(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL, true);
        mapper.registerModule(new ParameterNamesModule());
        mapper.registerModule(new JavaTimeModule());
    }

    /**
     * @return the first JSON object found in {@code text}, or empty when none parses
     */
    public Optional<JsonNode> readObject(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String cleaned = stripFences(text.trim());
        Optional<JsonNode> direct = tryRead(cleaned);
        if (direct.isPresent()) {
            return direct;
        }
        int open = cleaned.indexOf('{');
        int close = cleaned.lastIndexOf('}');
        if (open >= 0 && close > open) {
            return tryRead(cleaned.substring(open, close + 1));
        }
        return Optional.empty();
    }

    /**
     * Converts a JSON node into {@code type}.
     *
     * @throws LlmParseException when the node does not match the type
     */
    public <T> T convert(JsonNode node, Class<T> type) {
        try {
            return mapper.treeToValue(node, type);
        } catch (Exception e) {
            throw new LlmParseException("Failed to convert LLM JSON to " + type.getSimpleName()
                    + ": " + e.getMessage(), e);
        }
    }

    private Optional<JsonNode> tryRead(String candidate) {
        try {
            JsonNode node = mapper.readTree(candidate);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (Exception e) {
            return Optional.empty();
        }
    }

    private static String stripFences(String text) {
        String cleaned = text;
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
