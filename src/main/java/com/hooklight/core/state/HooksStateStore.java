package com.hooklight.core.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.hooklight.core.config.HooklightProperties;
import com.hooklight.core.persistence.LockedFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.UnaryOperator;

/**
 * Loads and stores {@link HooksState} for a project directory.
 * <p>
 * A missing or corrupt file loads as {@link HooksState#defaults()}. Writers should prefer
 * {@link #update} so a change is applied to the latest state on disk rather than to a copy that
 * another hook may have replaced in the meantime.
 */
public class HooksStateStore {

    private static final Logger log = LoggerFactory.getLogger(HooksStateStore.class);

    private final HooklightProperties properties;
    private final ObjectMapper objectMapper;

    public HooksStateStore(HooklightProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public HooksState load(Path cwd) {
        Path file = properties.hooksStateFile(cwd);
        try {
            return LockedFiles.withLock(file, () -> read(file));
        } catch (IOException e) {
            log.warn("Could not read hooks state {}: {}", file, e.getMessage());
            return HooksState.defaults();
        }
    }

    /**
     * Applies {@code change} to the current state on disk and writes the result, all under the
     * state file's lock. Nothing is written when {@code change} returns its argument unchanged.
     *
     * @return the state that was written
     * @throws IOException if the result cannot be written
     */
    public HooksState update(Path cwd, UnaryOperator<HooksState> change) throws IOException {
        Path file = properties.hooksStateFile(cwd);
        return LockedFiles.withLock(file, () -> {
            HooksState current = read(file);
            HooksState next = change.apply(current);
            if (next != current) {
                LockedFiles.writeAtomically(file, objectMapper.writeValueAsString(next));
            }
            return next;
        });
    }

    private HooksState read(Path file) throws IOException {
        var content = LockedFiles.readIfExists(file);
        if (content.isEmpty() || content.get().isBlank()) {
            return HooksState.defaults();
        }
        try {
            HooksState state = objectMapper.readValue(content.get(), HooksState.class);
            return state != null ? state : HooksState.defaults();
        } catch (JsonProcessingException e) {
            log.warn("Hooks state {} is corrupt, using defaults: {}", file, e.getOriginalMessage());
            return HooksState.defaults();
        }
    }
}
