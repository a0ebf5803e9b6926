package com.hooklight.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of a correlated subagent run, as judged by the post-hoc checks.
 * Heuristic: a run can be marked completed even if the subagent did the wrong thing.
 */
public enum TelemetryStatus {
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
