package com.hooklight.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.List;

/**
 * One line of the telemetry log: a subagent run whose start and stop were both observed.
 * Written once, never updated.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"event", "agent_id", "agent_type", "session_id", "project_name", "cwd",
        "git_branch", "git_commit", "task_description", "started_at", "ended_at", "duration_ms",
        "status", "keywords", "files_modified", "tools_used", "error_count", "final_summary"})
public record TelemetryRecord(
    @JsonProperty("event") String event,
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("agent_type") String agentType,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("project_name") String projectName,
    @JsonProperty("cwd") String cwd,
    @JsonProperty("git_branch") String gitBranch,
    @JsonProperty("git_commit") String gitCommit,
    @JsonProperty("task_description") String taskDescription,
    @JsonProperty("started_at") String startedAt,
    @JsonProperty("ended_at") String endedAt,
    @JsonProperty("duration_ms") long durationMs,
    @JsonProperty("status") TelemetryStatus status,
    @JsonProperty("keywords") List<String> keywords,
    @JsonProperty("files_modified") List<String> filesModified,
    @JsonProperty("tools_used") List<String> toolsUsed,
    @JsonProperty("error_count") int errorCount,
    @JsonProperty("final_summary") String finalSummary
) implements Serializable {

    public static final String SUBAGENT_COMPLETE = "subagent_complete";

    public TelemetryRecord {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        filesModified = filesModified == null ? List.of() : List.copyOf(filesModified);
        toolsUsed = toolsUsed == null ? List.of() : List.copyOf(toolsUsed);
    }
}
