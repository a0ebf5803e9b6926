package com.hooklight.core.engine;

import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Derives a human-friendly project name from a working directory.
 */
public final class ProjectNames {

    static final String UNKNOWN = "unknown-project";

    /** Leaf names that say nothing about the project: hashes and temp dirs. */
    private static final Pattern GENERATED_NAME = Pattern.compile("^[a-f0-9]{8,}$", Pattern.CASE_INSENSITIVE);

    private ProjectNames() {}

    /**
     * The directory's own name, or its parent's when the leaf looks generated
     * ({@code tmp}, {@code temp}, or a hex hash of eight or more characters).
     */
    public static String derive(Path cwd) {
        if (cwd == null) {
            return UNKNOWN;
        }
        Path normalized = cwd.normalize();
        String leaf = name(normalized);
        if (leaf == null) {
            return UNKNOWN;
        }
        if (GENERATED_NAME.matcher(leaf).matches() || leaf.equalsIgnoreCase("tmp") || leaf.equalsIgnoreCase("temp")) {
            String parent = normalized.getParent() == null ? null : name(normalized.getParent());
            return parent != null ? parent : UNKNOWN;
        }
        return leaf;
    }

    private static String name(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null || fileName.toString().isEmpty()) {
            return null;
        }
        return fileName.toString();
    }
}
