package com.hooklight.core.process;

/**
 * Outcome of an external command.
 *
 * @param exitCode process exit code, -1 when the command timed out
 * @param output   combined stdout and stderr
 * @param timedOut true when the process was killed after its timeout
 */
public record CommandResult(int exitCode, String output, boolean timedOut) {

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }
}
