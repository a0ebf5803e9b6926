package com.hooklight.core.transcript;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hooklight.core.model.ParsedTranscript;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Extracts tool usage, file modifications, error counts and the final message from a subagent
 * transcript.
 * <p>
 * Transcripts may be newline-delimited JSON, free text, or a mix of both. Each non-blank line
 * goes through the strategy chain; a strategy that throws costs only that line.
 */
public class TranscriptParser {

    private static final Logger log = LoggerFactory.getLogger(TranscriptParser.class);

    private final List<LineStrategy> strategies;

    public TranscriptParser(ObjectMapper objectMapper) {
        this(List.of(new StructuredRecordStrategy(objectMapper), new PlainTextStrategy()));
    }

    public TranscriptParser(List<LineStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    /**
     * Parses the transcript at {@code path}. A null, missing or unreadable path yields
     * {@link ParsedTranscript#empty()}. Malformed UTF-8 is decoded to U+FFFD, so a bad byte
     * costs only the line it sits on.
     */
    public ParsedTranscript parse(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            log.debug("Transcript file not found: {}", path);
            return ParsedTranscript.empty();
        }
        String content;
        try {
            content = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not read transcript {}: {}", path, e.getMessage());
            return ParsedTranscript.empty();
        }
        return parseContent(content);
    }

    public ParsedTranscript parseContent(String content) {
        var acc = new TranscriptAccumulator();
        if (content == null) {
            return acc.build(Optional.empty());
        }
        int lineNumber = 0;
        for (String line : content.split("\n")) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            applyStrategies(line, lineNumber, acc);
        }
        return acc.build(FinalOutputExtractor.extract(content));
    }

    private void applyStrategies(String line, int lineNumber, TranscriptAccumulator acc) {
        for (LineStrategy strategy : strategies) {
            try {
                if (strategy.apply(line, acc)) {
                    return;
                }
            } catch (RuntimeException e) {
                log.debug("Skipping transcript line {} after {} failed: {}",
                        lineNumber, strategy.getClass().getSimpleName(), e.getMessage());
                return;
            }
        }
    }
}
