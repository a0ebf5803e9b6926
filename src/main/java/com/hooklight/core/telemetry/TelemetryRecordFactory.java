package com.hooklight.core.telemetry;

import com.hooklight.core.keywords.KeywordExtractor;
import com.hooklight.core.model.ActiveAgentEntry;
import com.hooklight.core.model.ParsedTranscript;
import com.hooklight.core.model.TelemetryRecord;
import com.hooklight.core.model.TelemetryStatus;
import com.hooklight.core.model.TestVerificationResult;
import com.hooklight.core.model.ValidationResult;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the telemetry record for a correlated subagent run.
 */
public final class TelemetryRecordFactory {

    private TelemetryRecordFactory() {}

    public static TelemetryRecord create(ActiveAgentEntry entry, ValidationResult validation,
                                         TestVerificationResult tests, Instant endedAt) {
        ParsedTranscript transcript = validation.transcript() != null
                ? validation.transcript() : ParsedTranscript.empty();
        String finalSummary = transcript.finalOutput().orElse(null);

        return new TelemetryRecord(
                TelemetryRecord.SUBAGENT_COMPLETE,
                entry.agentId(),
                entry.agentType(),
                entry.sessionId(),
                entry.projectName(),
                entry.cwd(),
                entry.gitBranch(),
                entry.gitCommit(),
                entry.taskDescription(),
                entry.startedAt(),
                endedAt.toString(),
                durationMs(entry, endedAt),
                status(validation, tests),
                keywords(entry, transcript),
                transcript.filesModified(),
                transcript.toolsUsed(),
                transcript.errorCount(),
                finalSummary);
    }

    /**
     * {@code failed} when validation found problems or tests ran and failed.
     */
    public static TelemetryStatus status(ValidationResult validation, TestVerificationResult tests) {
        boolean testsFailed = tests != null && !tests.passed();
        return !validation.valid() || testsFailed ? TelemetryStatus.FAILED : TelemetryStatus.COMPLETED;
    }

    /**
     * Milliseconds since the entry started, never negative. 0 when {@code started_at} is unreadable.
     */
    public static long durationMs(ActiveAgentEntry entry, Instant endedAt) {
        return entry.parsedStartedAt()
                .map(started -> Math.max(0, Duration.between(started, endedAt).toMillis()))
                .orElse(0L);
    }

    static String keywordText(ParsedTranscript transcript) {
        var parts = new ArrayList<String>();
        transcript.finalOutput().ifPresent(parts::add);
        parts.addAll(transcript.successIndicators());
        parts.addAll(transcript.filesModified());
        return String.join(" ", parts);
    }

    static List<String> keywords(ActiveAgentEntry entry, ParsedTranscript transcript) {
        return KeywordExtractor.extract(entry.taskDescription(), keywordText(transcript), entry.agentType());
    }
}
