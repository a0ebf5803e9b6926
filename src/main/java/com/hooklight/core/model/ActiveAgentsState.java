package com.hooklight.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Persisted shape of the active agent registry file.
 *
 * @param agents      entries keyed by agent id
 * @param lastUpdated ISO-8601 instant of the last write
 */
public record ActiveAgentsState(
    @JsonProperty("agents") Map<String, ActiveAgentEntry> agents,
    @JsonProperty("last_updated") String lastUpdated
) {}
