package com.hooklight.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A failing test file and the output excerpt that reported it.
 */
public record TestFailure(
    @JsonProperty("testFile") String testFile,
    @JsonProperty("error") String error
) implements Serializable {}
