package com.hooklight.core.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hooklight.core.config.HooklightProperties;
import com.hooklight.core.git.GitInfoProvider;
import com.hooklight.core.logging.MdcContext;
import com.hooklight.core.metrics.HooklightMetrics;
import com.hooklight.core.model.ActiveAgentEntry;
import com.hooklight.core.model.GitInfo;
import com.hooklight.core.model.HookResponse;
import com.hooklight.core.model.TelemetryRecord;
import com.hooklight.core.model.TestVerificationResult;
import com.hooklight.core.model.ValidationResult;
import com.hooklight.core.registry.ActiveAgentRegistry;
import com.hooklight.core.state.FileTracker;
import com.hooklight.core.state.HooksState;
import com.hooklight.core.state.HooksStateStore;
import com.hooklight.core.telemetry.TelemetryRecordFactory;
import com.hooklight.core.telemetry.TelemetryWriter;
import com.hooklight.core.testing.TestVerifier;
import com.hooklight.core.validation.OutputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Correlates subagent spawn and stop events into telemetry records.
 * <p>
 * A spawn registers the agent in the project's active agent registry. The matching stop pops
 * it, verifies the agent's work (type check, affected tests), and appends one telemetry record.
 * A stop without a matching spawn is orphaned: its work is still verified when a transcript is
 * available, but no telemetry is written since identity and timing are unknown.
 * <p>
 * Both entry points always answer with {@code continue: true}; failures are logged and never
 * reach the host.
 */
@Service
public class SubagentLifecycleEngine {

    private static final Logger log = LoggerFactory.getLogger(SubagentLifecycleEngine.class);

    static final String CONTEXT_HEADER = "[Hooklight Project Context]";
    static final String MESSAGE_PREFIX = "[Hooklight]";

    private final HooklightProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final GitInfoProvider gitInfoProvider;
    private final OutputValidator outputValidator;
    private final TestVerifier testVerifier;
    private final TelemetryWriter telemetryWriter;
    private final HooksStateStore hooksStateStore;
    private final HooklightMetrics metrics;

    public SubagentLifecycleEngine(HooklightProperties properties,
                                   ObjectMapper objectMapper,
                                   Clock clock,
                                   GitInfoProvider gitInfoProvider,
                                   OutputValidator outputValidator,
                                   TestVerifier testVerifier,
                                   TelemetryWriter telemetryWriter,
                                   HooksStateStore hooksStateStore,
                                   HooklightMetrics metrics) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.gitInfoProvider = gitInfoProvider;
        this.outputValidator = outputValidator;
        this.testVerifier = testVerifier;
        this.telemetryWriter = telemetryWriter;
        this.hooksStateStore = hooksStateStore;
        this.metrics = metrics;
    }

    // -- Spawn --

    public HookResponse onSubagentStart(Map<String, Object> rawInput) {
        try {
            SubagentStartInput input = SubagentStartInput.from(rawInput, clock);
            MdcContext.setAgent(input.agentId(), input.agentType());
            MdcContext.setSession(input.sessionId());
            log.debug("Subagent start in {}", input.cwd());

            ActiveAgentRegistry registry = registryFor(input.cwd());
            evictStale(registry);

            GitInfo git = gitInfoProvider.getGitInfo(input.cwd());
            String projectName = ProjectNames.derive(input.cwd());

            var entry = new ActiveAgentEntry(
                    input.agentId(),
                    input.agentType(),
                    input.sessionId(),
                    input.cwd().toString(),
                    projectName,
                    clock.instant().toString(),
                    git.branch(),
                    git.commit(),
                    truncateTask(input.taskDescription()));
            registry.register(entry);
            metrics.recordSpawn(input.agentType());
            log.info("Subagent {} ({}) started in project {}", input.agentId(), input.agentType(), projectName);

            recordSession(input.cwd(), input.sessionId());

            return HookResponse.proceed()
                    .withAdditionalContext(projectContext(git, projectName))
                    .withSystemMessage(startMessage(input.agentType(), projectName, git));
        } catch (Exception e) {
            log.error("Subagent start handling failed", e);
            return HookResponse.proceed();
        } finally {
            MdcContext.clear();
        }
    }

    // -- Stop --

    public HookResponse onSubagentStop(Map<String, Object> rawInput) {
        try {
            SubagentStopInput input = SubagentStopInput.from(rawInput);
            MdcContext.setAgent(input.agentId(), input.agentType());
            MdcContext.setSession(input.sessionId());

            Optional<ActiveAgentEntry> entry = registryFor(input.cwd()).pop(input.agentId());
            if (entry.isPresent()) {
                return completeCorrelated(input, entry.get());
            }
            return completeOrphaned(input);
        } catch (Exception e) {
            log.error("Subagent stop handling failed", e);
            return HookResponse.proceed();
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Evicts stale registry entries for {@code cwd}.
     *
     * @return number of evicted entries
     */
    public int cleanup(Path cwd, Duration maxAge) {
        return evictStale(registryFor(cwd), maxAge);
    }

    private HookResponse completeCorrelated(SubagentStopInput input, ActiveAgentEntry entry) {
        String agentType = input.agentType() != null ? input.agentType() : entry.agentType();
        MdcContext.setAgent(entry.agentId(), agentType);
        MdcContext.setSession(entry.sessionId());

        HooksState state = hooksStateStore.load(input.cwd());
        ValidationResult validation = outputValidator.validate(input.cwd(), input.transcriptPath(), state);
        TestVerificationResult tests = validation.filesModified().isEmpty()
                ? null
                : testVerifier.verify(input.cwd(), validation.filesModified(), validation.state());

        persistState(input.cwd(), validation, tests);

        if (entry.parsedStartedAt().isEmpty()) {
            log.warn("Agent {} has unreadable started_at '{}', duration recorded as 0",
                    entry.agentId(), entry.startedAt());
        }
        Instant endedAt = clock.instant();
        TelemetryRecord record = TelemetryRecordFactory.create(entry, validation, tests, endedAt);
        boolean telemetryWritten = writeTelemetry(input.cwd(), record);

        metrics.recordCompletion(agentType, record.status().wireName(), record.durationMs());
        metrics.recordFilesModified(validation.filesModified().size());
        log.info("Subagent {} ({}) finished: status={}, duration={}ms, files={}",
                entry.agentId(), agentType, record.status().wireName(), record.durationMs(),
                validation.filesModified().size());

        return stopResponse(entry.agentId(), agentType, validation, tests, telemetryWritten, record.durationMs());
    }

    private HookResponse completeOrphaned(SubagentStopInput input) {
        String agentType = input.agentType() != null ? input.agentType() : "unknown";
        log.warn("No matching start for subagent '{}', telemetry will not be written", input.agentId());
        metrics.recordOrphanedStop(agentType);

        ValidationResult validation = null;
        TestVerificationResult tests = null;
        if (input.transcriptPath() != null) {
            HooksState state = hooksStateStore.load(input.cwd());
            validation = outputValidator.validate(input.cwd(), input.transcriptPath(), state);
            if (!validation.filesModified().isEmpty()) {
                tests = testVerifier.verify(input.cwd(), validation.filesModified(), validation.state());
            }
            persistState(input.cwd(), validation, tests);
        }
        return stopResponse(input.agentId(), agentType, validation, tests, false, null);
    }

    // -- Helpers --

    ActiveAgentRegistry registryFor(Path cwd) {
        return new ActiveAgentRegistry(properties.activeAgentsFile(cwd), objectMapper, clock);
    }

    private void evictStale(ActiveAgentRegistry registry) {
        evictStale(registry, properties.getRegistry().getStaleAfter());
    }

    private int evictStale(ActiveAgentRegistry registry, Duration maxAge) {
        int evicted = registry.cleanupStale(maxAge);
        if (evicted > 0) {
            metrics.recordStaleEvictions(evicted);
        }
        return evicted;
    }

    private void recordSession(Path cwd, String sessionId) {
        if (sessionId.isEmpty()) {
            return;
        }
        try {
            hooksStateStore.update(cwd, current -> {
                if (!current.getSession().getId().isEmpty()) {
                    return current;
                }
                HooksState next = current.copy();
                next.getSession().setId(sessionId);
                next.getSession().setStartedAt(clock.instant().toString());
                return next;
            });
        } catch (IOException e) {
            log.warn("Could not record session id in hooks state: {}", e.getMessage());
        }
    }

    private boolean writeTelemetry(Path cwd, TelemetryRecord record) {
        try {
            telemetryWriter.write(cwd, record);
            return true;
        } catch (IOException e) {
            log.warn("Could not write telemetry for {}: {}", record.agentId(), e.getMessage());
            metrics.recordTelemetryFailure();
            return false;
        }
    }

    /**
     * Replays the tracked files and test outcome on the latest state on disk, so updates made by
     * other hooks while this one was verifying are kept.
     */
    private void persistState(Path cwd, ValidationResult validation, TestVerificationResult tests) {
        if (validation.filesModified().isEmpty() && (tests == null || !tests.ran())) {
            return;
        }
        try {
            hooksStateStore.update(cwd, fresh -> {
                HooksState next = fresh.copy();
                for (String file : validation.filesModified()) {
                    next = FileTracker.trackModification(next, file);
                }
                if (tests != null) {
                    next = TestVerifier.applyOutcome(next, tests);
                }
                return next;
            });
        } catch (IOException e) {
            log.warn("Could not save hooks state: {}", e.getMessage());
        }
    }

    private String truncateTask(String taskDescription) {
        if (taskDescription == null || taskDescription.isEmpty()) {
            return null;
        }
        int max = properties.getRegistry().getTaskDescriptionMaxLength();
        return taskDescription.length() > max ? taskDescription.substring(0, max) : taskDescription;
    }

    static String projectContext(GitInfo git, String projectName) {
        var lines = new ArrayList<String>();
        lines.add(CONTEXT_HEADER);
        if (git.branch() != null) {
            lines.add("Git branch: " + git.branch());
        }
        lines.add("Project: " + projectName);
        return String.join("\n", lines);
    }

    /**
     * Only namespaced agent types ({@code plugin:role}) get a start message.
     */
    static String startMessage(String agentType, String projectName, GitInfo git) {
        if (!agentType.contains(":")) {
            return null;
        }
        return MESSAGE_PREFIX + " Agent " + agentType + " starting. Project: " + projectName
                + (git.branch() != null ? ", Branch: " + git.branch() : "");
    }

    static HookResponse stopResponse(String agentId, String agentType, ValidationResult validation,
                                     TestVerificationResult tests, boolean telemetryWritten, Long durationMs) {
        var issues = new ArrayList<String>();
        if (validation != null && !validation.valid()) {
            issues.add("Validation errors: " + String.join(", ", validation.errors()));
        }
        if (tests != null && !tests.passed()) {
            issues.add("Test failures: " + tests.summary());
        }

        var output = new LinkedHashMap<String, Object>();
        output.put("validation", validation);
        output.put("tests", tests);
        output.put("telemetryWritten", telemetryWritten);
        output.put("agentId", agentId);
        output.put("agentType", agentType);
        output.put("durationMs", durationMs);

        HookResponse response = HookResponse.proceed().withOutput(output);
        if (!issues.isEmpty()) {
            response = response.withSystemMessage(MESSAGE_PREFIX + " Agent " + agentType
                    + " completed with issues: " + String.join("; ", issues));
        }
        return response;
    }
}
