package com.hooklight.core.transcript;

/**
 * One way of interpreting a single transcript line.
 * Strategies are tried in order until one accepts the line.
 */
public interface LineStrategy {

    /**
     * Interprets {@code line} and records what it finds.
     *
     * @return true if the line was handled, false to let the next strategy try
     */
    boolean apply(String line, TranscriptAccumulator acc);
}
