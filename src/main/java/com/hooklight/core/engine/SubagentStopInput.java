package com.hooklight.core.engine;

import java.nio.file.Path;
import java.util.Map;

/**
 * Normalized input of a subagent stop event.
 *
 * @param agentId        {@code agent_id} or {@code subagent_id}, else empty (never matches)
 * @param agentType      {@code agent_type} or {@code subagent_type}, null when absent
 * @param sessionId      {@code session_id}, null when absent
 * @param transcriptPath {@code agent_transcript_path} or {@code subagent_transcript_path},
 *                       resolved against {@code cwd}; null when absent
 * @param cwd            {@code cwd}, else the process working directory
 */
public record SubagentStopInput(
    String agentId,
    String agentType,
    String sessionId,
    Path transcriptPath,
    Path cwd
) {

    public static SubagentStopInput from(Map<String, Object> input) {
        Path cwd = SubagentStartInput.resolveCwd(HookInputs.firstNonEmpty(input, "cwd"));
        String transcript = HookInputs.firstNonEmpty(input, "agent_transcript_path", "subagent_transcript_path");
        return new SubagentStopInput(
                HookInputs.orDefault(HookInputs.firstNonEmpty(input, "agent_id", "subagent_id"), ""),
                HookInputs.firstNonEmpty(input, "agent_type", "subagent_type"),
                HookInputs.firstNonEmpty(input, "session_id"),
                transcript != null ? cwd.resolve(transcript) : null,
                cwd);
    }
}
