package com.hooklight.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * JSON object printed back to the host runtime after a hook runs.
 * {@code continue} is always true: this tool never blocks the host.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HookResponse(
    @JsonProperty("continue") boolean shouldContinue,
    @JsonProperty("systemMessage") String systemMessage,
    @JsonProperty("additionalContext") String additionalContext,
    @JsonProperty("output") Map<String, Object> output
) {

    public static HookResponse proceed() {
        return new HookResponse(true, null, null, null);
    }

    public HookResponse withSystemMessage(String message) {
        return new HookResponse(shouldContinue, message, additionalContext, output);
    }

    public HookResponse withAdditionalContext(String context) {
        return new HookResponse(shouldContinue, systemMessage, context, output);
    }

    public HookResponse withOutput(Map<String, Object> value) {
        return new HookResponse(shouldContinue, systemMessage, additionalContext, value);
    }
}
