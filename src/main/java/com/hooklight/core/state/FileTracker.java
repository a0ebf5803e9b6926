package com.hooklight.core.state;

/**
 * Records files touched during the session.
 */
public final class FileTracker {

    private FileTracker() {}

    /**
     * Returns a copy of {@code state} with {@code file} added to both the per-session and the
     * since-checkpoint lists. Files already listed are not added twice.
     */
    public static HooksState trackModification(HooksState state, String file) {
        var next = state.copy();
        var files = next.getFiles();
        if (!files.getModifiedThisSession().contains(file)) {
            files.getModifiedThisSession().add(file);
        }
        if (!files.getModifiedSinceCheckpoint().contains(file)) {
            files.getModifiedSinceCheckpoint().add(file);
        }
        return next;
    }
}
