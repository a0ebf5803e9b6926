package com.hooklight.core.model;

import java.util.List;

/**
 * Result of a project-wide type check.
 *
 * @param passed     whether the checker exited cleanly
 * @param errorCount number of reported errors
 * @param errors     error lines as {@code file:line - message}, possibly a subset
 */
public record TypeCheckResult(boolean passed, int errorCount, List<String> errors) {

    public TypeCheckResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static TypeCheckResult ok() {
        return new TypeCheckResult(true, 0, List.of());
    }
}
