package com.hooklight.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * A subagent that has been spawned and not yet stopped.
 *
 * @param agentId         unique among currently active entries
 * @param agentType       role label, e.g. "backend-engineer" or "plugin:backend-engineer"
 * @param sessionId       the orchestrating session, used for correlation only
 * @param cwd             absolute working directory of the spawn
 * @param projectName     derived from {@code cwd}
 * @param startedAt       ISO-8601 instant of the spawn event
 * @param gitBranch       branch at spawn time, nullable
 * @param gitCommit       short commit hash at spawn time, nullable
 * @param taskDescription truncated task text, nullable
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ActiveAgentEntry(
    @JsonProperty("agent_id") String agentId,
    @JsonProperty("agent_type") String agentType,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("cwd") String cwd,
    @JsonProperty("project_name") String projectName,
    @JsonProperty("started_at") String startedAt,
    @JsonProperty("git_branch") String gitBranch,
    @JsonProperty("git_commit") String gitCommit,
    @JsonProperty("task_description") String taskDescription
) {

    /**
     * Parses {@link #startedAt()}; empty when it is missing or not an ISO-8601 instant.
     */
    public Optional<Instant> parsedStartedAt() {
        if (startedAt == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(startedAt));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
