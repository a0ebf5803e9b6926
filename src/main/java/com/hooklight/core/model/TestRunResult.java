package com.hooklight.core.model;

import java.util.List;

/**
 * What a {@link com.hooklight.core.testing.TestRunner} reports for one run.
 */
public record TestRunResult(boolean passed, String summary, List<TestFailure> failures) {

    public TestRunResult {
        failures = failures == null ? List.of() : List.copyOf(failures);
    }
}
