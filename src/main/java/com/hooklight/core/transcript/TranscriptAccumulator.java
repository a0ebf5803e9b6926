package com.hooklight.core.transcript;

import com.hooklight.core.model.ParsedTranscript;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable collector that line strategies write into while a transcript is parsed.
 */
public final class TranscriptAccumulator {

    static final int MAX_INDICATOR_LENGTH = 100;

    private final Set<String> filesModified = new LinkedHashSet<>();
    private final Set<String> toolsUsed = new LinkedHashSet<>();
    private final Set<String> successIndicators = new LinkedHashSet<>();
    private int errorCount;

    public void addTool(String tool) {
        toolsUsed.add(tool);
    }

    public void addFile(String file) {
        filesModified.add(file);
    }

    public void addSuccessIndicator(String text) {
        successIndicators.add(text.length() > MAX_INDICATOR_LENGTH ? text.substring(0, MAX_INDICATOR_LENGTH) : text);
    }

    public void incrementErrors() {
        errorCount++;
    }

    public ParsedTranscript build(Optional<String> finalOutput) {
        return new ParsedTranscript(
                filesModified.stream().toList(),
                toolsUsed.stream().toList(),
                errorCount,
                successIndicators.stream().toList(),
                finalOutput);
    }
}
