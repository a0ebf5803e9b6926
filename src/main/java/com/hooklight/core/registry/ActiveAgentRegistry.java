package com.hooklight.core.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.hooklight.core.model.ActiveAgentEntry;
import com.hooklight.core.model.ActiveAgentsState;
import com.hooklight.core.persistence.LockedFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * File-backed registry of subagents that have started but not yet stopped.
 * <p>
 * Several hook processes may touch the same file at once, so every mutation reloads the file
 * under {@link LockedFiles#withLock}, applies one change, and writes the whole document back
 * before releasing the lock. Nothing is cached between calls.
 * <p>
 * A missing, unparsable, or wrongly shaped file reads as an empty registry; the next mutation
 * replaces it.
 */
public class ActiveAgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActiveAgentRegistry.class);

    /** Entries older than this are assumed to belong to crashed subagents. */
    public static final Duration DEFAULT_STALE_AFTER = Duration.ofHours(24);

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ActiveAgentRegistry(Path file, ObjectMapper objectMapper, Clock clock) {
        this.file = file;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    /**
     * Inserts or replaces the entry for {@code entry.agentId()}. A repeated spawn notification
     * for the same id simply overwrites the earlier entry.
     */
    public void register(ActiveAgentEntry entry) {
        mutate(agents -> {
            agents.put(entry.agentId(), entry);
            return true;
        });
        log.debug("Registered active agent {} ({})", entry.agentId(), entry.agentType());
    }

    /**
     * Removes and returns the entry for {@code agentId}, or empty if it is not registered
     * (never registered, already popped, or evicted as stale).
     */
    public Optional<ActiveAgentEntry> pop(String agentId) {
        var removed = new ActiveAgentEntry[1];
        mutate(agents -> {
            removed[0] = agents.remove(agentId);
            return removed[0] != null;
        });
        if (removed[0] == null) {
            log.debug("Agent {} not found in active agents", agentId);
        } else {
            log.debug("Popped active agent {}", agentId);
        }
        return Optional.ofNullable(removed[0]);
    }

    public int cleanupStale() {
        return cleanupStale(DEFAULT_STALE_AFTER);
    }

    /**
     * Evicts entries whose {@code started_at} is more than {@code maxAge} before now. Entries
     * with an unparsable timestamp are evicted as well. The file is rewritten only when
     * something was removed.
     *
     * @return number of evicted entries
     */
    public int cleanupStale(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        var evicted = new ArrayList<String>();
        mutate(agents -> {
            Iterator<Map.Entry<String, ActiveAgentEntry>> it = agents.entrySet().iterator();
            while (it.hasNext()) {
                var e = it.next();
                if (isOlderThan(e.getValue(), cutoff)) {
                    evicted.add(e.getKey());
                    it.remove();
                }
            }
            return !evicted.isEmpty();
        });
        if (!evicted.isEmpty()) {
            log.info("Cleaned up {} stale agent entries: {}", evicted.size(), evicted);
        }
        return evicted.size();
    }

    /**
     * Reads the current registry without modifying it.
     */
    public ActiveAgentsState snapshot() {
        try {
            return LockedFiles.withLock(file, this::load);
        } catch (IOException e) {
            log.warn("Could not read active agents from {}: {}", file, e.getMessage());
            return emptyState();
        }
    }

    @FunctionalInterface
    private interface Mutation {
        /** @return true if the map changed and must be written back */
        boolean apply(Map<String, ActiveAgentEntry> agents);
    }

    private void mutate(Mutation mutation) {
        try {
            LockedFiles.withLock(file, () -> {
                var state = load();
                var agents = new LinkedHashMap<>(state.agents());
                if (mutation.apply(agents)) {
                    save(new ActiveAgentsState(agents, clock.instant().toString()));
                }
                return null;
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to update active agents file " + file, e);
        }
    }

    private ActiveAgentsState load() throws IOException {
        var content = LockedFiles.readIfExists(file);
        if (content.isEmpty() || content.get().isBlank()) {
            return emptyState();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(content.get());
        } catch (JsonProcessingException e) {
            log.warn("Active agents file {} is not valid JSON, starting empty: {}", file, e.getOriginalMessage());
            return emptyState();
        }
        if (!hasRegistryShape(root)) {
            log.warn("Active agents file {} has an unexpected shape, starting empty", file);
            return emptyState();
        }

        var agents = new LinkedHashMap<String, ActiveAgentEntry>();
        root.get("agents").fields().forEachRemaining(field -> {
            try {
                agents.put(field.getKey(), objectMapper.treeToValue(field.getValue(), ActiveAgentEntry.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("Dropping unreadable active agent entry {}: {}", field.getKey(), e.getMessage());
            }
        });
        return new ActiveAgentsState(agents, root.get("last_updated").asText());
    }

    private void save(ActiveAgentsState state) throws IOException {
        LockedFiles.writeAtomically(file, objectMapper.writeValueAsString(state));
    }

    private ActiveAgentsState emptyState() {
        return new ActiveAgentsState(new LinkedHashMap<>(), clock.instant().toString());
    }

    static boolean hasRegistryShape(JsonNode root) {
        return root != null
                && root.isObject()
                && root.path("agents").isObject()
                && root.path("last_updated").isTextual();
    }

    private static boolean isOlderThan(ActiveAgentEntry entry, Instant cutoff) {
        return entry.parsedStartedAt().map(started -> started.isBefore(cutoff)).orElse(true);
    }
}
