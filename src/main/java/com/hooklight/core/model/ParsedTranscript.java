package com.hooklight.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Facts mined from one subagent transcript. All lists are deduplicated, first occurrence kept.
 *
 * @param filesModified     paths written or edited by the subagent
 * @param toolsUsed         tool names in order of first use
 * @param errorCount        number of lines that reported an error
 * @param successIndicators short snippets of success messages, at most 100 chars each
 * @param finalOutput       last assistant message, truncated to 500 chars plus "..."
 */
public record ParsedTranscript(
    List<String> filesModified,
    List<String> toolsUsed,
    int errorCount,
    List<String> successIndicators,
    Optional<String> finalOutput
) {

    public ParsedTranscript {
        filesModified = List.copyOf(filesModified);
        toolsUsed = List.copyOf(toolsUsed);
        successIndicators = List.copyOf(successIndicators);
        finalOutput = finalOutput == null ? Optional.empty() : finalOutput;
    }

    /**
     * Result used when the transcript is missing or unreadable.
     */
    public static ParsedTranscript empty() {
        return new ParsedTranscript(List.of(), List.of(), 0, List.of(), Optional.empty());
    }
}
