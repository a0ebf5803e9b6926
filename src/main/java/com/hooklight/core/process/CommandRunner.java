package com.hooklight.core.process;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs external commands with a bounded wait.
 */
public interface CommandRunner {

    /**
     * Runs {@code command} in {@code workDir}, killing it if it outlives {@code timeout}.
     *
     * @throws IOException          if the process cannot be started
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    CommandResult run(List<String> command, Path workDir, Duration timeout) throws IOException, InterruptedException;
}
