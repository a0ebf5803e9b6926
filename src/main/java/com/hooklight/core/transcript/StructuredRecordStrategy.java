package com.hooklight.core.transcript;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Handles lines that are JSON documents. Objects are read as transcript records; any other
 * JSON value is accepted and ignored.
 */
public class StructuredRecordStrategy implements LineStrategy {

    static final Set<String> FILE_MODIFYING_TOOLS = Set.of("Write", "Edit", "MultiEdit", "write_file", "edit_file");

    private static final List<String> INPUT_FIELDS = List.of("tool_input", "input", "parameters");
    private static final List<String> PATH_FIELDS = List.of("file_path", "path", "file");
    private static final List<String> TEXT_FIELDS = List.of("content", "text", "message");
    private static final List<String> SUCCESS_WORDS = List.of("successfully", "completed", "done");

    private final ObjectMapper objectMapper;

    public StructuredRecordStrategy(ObjectMapper objectMapper) {
        // "42 files changed" must not be read as the number 42
        this.objectMapper = objectMapper.copy().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    @Override
    public boolean apply(String line, TranscriptAccumulator acc) {
        JsonNode node;
        try {
            node = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            return false;
        }
        if (node == null || node.isMissingNode()) {
            return false;
        }
        if (node.isObject()) {
            recordToolUse(node, acc);
            recordContentBlocks(node, acc);
            recordError(node, acc);
            recordSuccess(node, acc);
        }
        return true;
    }

    private void recordToolUse(JsonNode record, TranscriptAccumulator acc) {
        String toolName = firstText(record, "tool_name", "name");
        boolean toolUse = "tool_use".equals(record.path("type").asText(null)) || toolName != null;
        if (!toolUse || toolName == null) {
            return;
        }
        acc.addTool(toolName);
        if (FILE_MODIFYING_TOOLS.contains(toolName)) {
            String path = extractFilePath(record);
            if (path != null) {
                acc.addFile(path);
            }
        }
    }

    /**
     * Host transcripts nest tool calls as {@code tool_use} blocks inside {@code message.content}.
     */
    private void recordContentBlocks(JsonNode record, TranscriptAccumulator acc) {
        for (JsonNode content : List.of(record.path("message").path("content"), record.path("content"))) {
            if (!content.isArray()) {
                continue;
            }
            for (JsonNode block : content) {
                if (block.isObject() && "tool_use".equals(block.path("type").asText(null))) {
                    recordToolUse(block, acc);
                }
            }
        }
    }

    private void recordError(JsonNode record, TranscriptAccumulator acc) {
        if ("error".equals(record.path("type").asText(null)) || isTruthy(record.get("error"))) {
            acc.incrementErrors();
        }
    }

    private void recordSuccess(JsonNode record, TranscriptAccumulator acc) {
        String text = "";
        for (String field : TEXT_FIELDS) {
            JsonNode value = record.get(field);
            if (value != null && !value.isNull()) {
                text = value.isValueNode() ? value.asText() : "";
                break;
            }
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String word : SUCCESS_WORDS) {
            if (lower.contains(word)) {
                acc.addSuccessIndicator(lower);
                return;
            }
        }
    }

    static String extractFilePath(JsonNode record) {
        JsonNode input = null;
        for (String field : INPUT_FIELDS) {
            JsonNode candidate = record.get(field);
            if (candidate != null && !candidate.isNull()) {
                input = candidate;
                break;
            }
        }
        if (input == null || !input.isObject()) {
            return null;
        }
        for (String field : PATH_FIELDS) {
            JsonNode candidate = input.get(field);
            if (candidate != null && !candidate.isNull()) {
                return candidate.isTextual() ? candidate.asText() : null;
            }
        }
        return null;
    }

    private static String firstText(JsonNode record, String... fields) {
        for (String field : fields) {
            JsonNode value = record.get(field);
            if (value != null && !value.isNull()) {
                String text = value.isValueNode() ? value.asText() : null;
                return text == null || text.isEmpty() ? null : text;
            }
        }
        return null;
    }

    static boolean isTruthy(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return false;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.doubleValue() != 0;
        }
        if (value.isTextual()) {
            return !value.textValue().isEmpty();
        }
        return true;
    }
}
