package com.hooklight.core.transcript;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hooklight.core.model.ParsedTranscript;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class StructuredRecordStrategyTest {

    private StructuredRecordStrategy strategy;
    private TranscriptAccumulator acc;

    @BeforeEach
    void setUp() {
        strategy = new StructuredRecordStrategy(new ObjectMapper());
        acc = new TranscriptAccumulator();
    }

    private ParsedTranscript result() {
        return acc.build(Optional.empty());
    }

    @Test
    @DisplayName("file_path wins over path and file")
    void pathPriority() {
        assertTrue(strategy.apply("{\"tool_name\":\"Write\",\"tool_input\":"
                + "{\"file\":\"c.ts\",\"path\":\"b.ts\",\"file_path\":\"a.ts\"}}", acc));
        assertEquals(List.of("a.ts"), result().filesModified());
    }

    @Test
    @DisplayName("path is used when file_path is absent")
    void pathFallback() {
        strategy.apply("{\"tool_name\":\"Edit\",\"tool_input\":{\"file\":\"c.ts\",\"path\":\"b.ts\"}}", acc);
        assertEquals(List.of("b.ts"), result().filesModified());
    }

    @Test
    @DisplayName("a non-string path is ignored")
    void nonStringPath() {
        strategy.apply("{\"tool_name\":\"Write\",\"tool_input\":{\"file_path\":42}}", acc);
        assertEquals(List.of("Write"), result().toolsUsed());
        assertTrue(result().filesModified().isEmpty());
    }

    @Test
    @DisplayName("read-only tools never record files")
    void readOnlyTool() {
        strategy.apply("{\"tool_name\":\"Read\",\"tool_input\":{\"file_path\":\"a.ts\"}}", acc);
        assertTrue(result().filesModified().isEmpty());
    }

    @Test
    @DisplayName("input object is taken from tool_input, then input, then parameters")
    void inputPriority() {
        strategy.apply("{\"name\":\"write_file\",\"input\":{\"file_path\":\"in.ts\"},"
                + "\"parameters\":{\"file_path\":\"params.ts\"}}", acc);
        assertEquals(List.of("in.ts"), result().filesModified());
    }

    @Test
    @DisplayName("tool_use blocks nested in message.content are interpreted")
    void nestedContentBlocks() {
        strategy.apply("{\"type\":\"assistant\",\"message\":{\"role\":\"assistant\",\"content\":["
                + "{\"type\":\"text\",\"text\":\"Let me fix it\"},"
                + "{\"type\":\"tool_use\",\"name\":\"MultiEdit\",\"input\":{\"file_path\":\"src/x.ts\"}}]}}", acc);
        assertEquals(List.of("MultiEdit"), result().toolsUsed());
        assertEquals(List.of("src/x.ts"), result().filesModified());
    }

    @Test
    @DisplayName("non-JSON lines are declined")
    void declinesPlainText() {
        assertFalse(strategy.apply("writing a.ts", acc));
        assertFalse(strategy.apply("42 files changed", acc));
    }

    @Test
    @DisplayName("JSON scalars are accepted and ignored")
    void acceptsScalars() {
        assertTrue(strategy.apply("42", acc));
        assertTrue(strategy.apply("\"done\"", acc));
        assertEquals(ParsedTranscript.empty(), result());
    }

    @Test
    @DisplayName("truthiness follows JSON semantics")
    void truthiness() {
        var mapper = new ObjectMapper();
        assertFalse(StructuredRecordStrategy.isTruthy(null));
        assertFalse(StructuredRecordStrategy.isTruthy(mapper.nullNode()));
        assertFalse(StructuredRecordStrategy.isTruthy(mapper.getNodeFactory().numberNode(0)));
        assertTrue(StructuredRecordStrategy.isTruthy(mapper.getNodeFactory().numberNode(2)));
        assertTrue(StructuredRecordStrategy.isTruthy(mapper.createObjectNode()));
    }
}
