package com.hooklight.core.engine;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;

/**
 * Normalized input of a subagent spawn event.
 *
 * @param agentId         {@code agent_id} or {@code subagent_id}, else {@code agent_<epochMillis>}
 * @param agentType       {@code agent_type} or {@code subagent_type}, else {@code unknown}
 * @param sessionId       {@code session_id}, else empty
 * @param taskDescription {@code task_description} or {@code task}, else empty
 * @param cwd             {@code cwd}, else the process working directory
 */
public record SubagentStartInput(
    String agentId,
    String agentType,
    String sessionId,
    String taskDescription,
    Path cwd
) {

    public static SubagentStartInput from(Map<String, Object> input, Clock clock) {
        return new SubagentStartInput(
                HookInputs.orDefault(HookInputs.firstNonEmpty(input, "agent_id", "subagent_id"),
                        "agent_" + clock.millis()),
                HookInputs.orDefault(HookInputs.firstNonEmpty(input, "agent_type", "subagent_type"), "unknown"),
                HookInputs.orDefault(HookInputs.firstNonEmpty(input, "session_id"), ""),
                HookInputs.orDefault(HookInputs.firstNonEmpty(input, "task_description", "task"), ""),
                resolveCwd(HookInputs.firstNonEmpty(input, "cwd")));
    }

    static Path resolveCwd(String cwd) {
        return (cwd != null ? Path.of(cwd) : Path.of("")).toAbsolutePath().normalize();
    }
}
