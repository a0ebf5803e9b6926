package com.hooklight.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hooklight.core.state.HooksState;

import java.util.List;

/**
 * Result of validating a subagent's output.
 *
 * @param valid         false when any error was recorded
 * @param filesModified files the transcript shows as written
 * @param errors        human readable problems found
 * @param state         shared session state with the modified files tracked
 * @param transcript    the parsed transcript, reused for telemetry
 */
public record ValidationResult(
    @JsonProperty("valid") boolean valid,
    @JsonProperty("filesModified") List<String> filesModified,
    @JsonProperty("errors") List<String> errors,
    @JsonIgnore HooksState state,
    @JsonIgnore ParsedTranscript transcript
) {

    public ValidationResult {
        filesModified = List.copyOf(filesModified);
        errors = List.copyOf(errors);
    }
}
