package com.hooklight.core.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A failing test that still needs attention in this session.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PendingFix(
    @JsonProperty("testFile") String testFile,
    @JsonProperty("error") String error,
    @JsonProperty("fixAttempts") int fixAttempts
) implements Serializable {}
