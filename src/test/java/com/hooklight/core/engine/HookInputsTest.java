package com.hooklight.core.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HookInputsTest {

    private final Clock clock = Clock.fixed(Instant.ofEpochMilli(1_700_000_000_000L), ZoneOffset.UTC);

    @Test
    @DisplayName("primary field names win over aliases")
    void primaryWins() {
        var input = SubagentStartInput.from(Map.of(
                "agent_id", "a1", "subagent_id", "s1",
                "agent_type", "backend-engineer", "subagent_type", "other",
                "task_description", "primary", "task", "alias",
                "cwd", "/work/shop"), clock);

        assertEquals("a1", input.agentId());
        assertEquals("backend-engineer", input.agentType());
        assertEquals("primary", input.taskDescription());
        assertEquals(Path.of("/work/shop"), input.cwd());
    }

    @Test
    @DisplayName("empty strings fall through to aliases and defaults")
    void emptyFallsThrough() {
        var input = SubagentStartInput.from(Map.of("agent_id", "", "subagent_id", "s1", "agent_type", ""), clock);

        assertEquals("s1", input.agentId());
        assertEquals("unknown", input.agentType());
        assertEquals("", input.sessionId());
        assertEquals("", input.taskDescription());
    }

    @Test
    @DisplayName("missing id is generated from the clock")
    void generatedId() {
        assertEquals("agent_1700000000000", SubagentStartInput.from(Map.of(), clock).agentId());
    }

    @Test
    @DisplayName("missing cwd resolves to the process directory")
    void defaultCwd() {
        assertEquals(Path.of("").toAbsolutePath().normalize(), SubagentStartInput.from(new HashMap<>(), clock).cwd());
    }

    @Test
    @DisplayName("relative transcript paths resolve against cwd")
    void relativeTranscript() {
        var input = SubagentStopInput.from(Map.of("cwd", "/work/shop", "subagent_transcript_path", "t/run.jsonl"));

        assertEquals(Path.of("/work/shop/t/run.jsonl"), input.transcriptPath());
        assertEquals("", input.agentId());
        assertNull(input.agentType());
        assertNull(input.sessionId());
    }

    @Test
    @DisplayName("absolute transcript paths are kept")
    void absoluteTranscript() {
        var input = SubagentStopInput.from(Map.of("cwd", "/work/shop", "agent_transcript_path", "/var/t.jsonl"));
        assertEquals(Path.of("/var/t.jsonl"), input.transcriptPath());
    }
}
