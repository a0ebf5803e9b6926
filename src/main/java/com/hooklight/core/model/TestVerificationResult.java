package com.hooklight.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hooklight.core.state.HooksState;

import java.util.List;

/**
 * Outcome of running the tests that cover a subagent's modified files.
 *
 * @param ran       false when no tests were found or the runner could not start
 * @param passed    true when nothing ran
 * @param summary   one-line description
 * @param testFiles deduplicated test files that were run
 * @param failures  failures reported by the runner
 * @param state     shared session state with the outcome applied
 */
public record TestVerificationResult(
    @JsonProperty("ran") boolean ran,
    @JsonProperty("passed") boolean passed,
    @JsonProperty("summary") String summary,
    @JsonProperty("testFiles") List<String> testFiles,
    @JsonProperty("failures") List<TestFailure> failures,
    @JsonIgnore HooksState state
) {

    public static final String NO_TESTS_SUMMARY = "No tests for modified files";

    public TestVerificationResult {
        testFiles = testFiles == null ? List.of() : List.copyOf(testFiles);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static TestVerificationResult notRun(String summary, HooksState state) {
        return new TestVerificationResult(false, true, summary, List.of(), List.of(), state);
    }
}
