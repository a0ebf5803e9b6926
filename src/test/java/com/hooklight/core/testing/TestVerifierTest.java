package com.hooklight.core.testing;

import com.hooklight.core.model.TestFailure;
import com.hooklight.core.model.TestRunResult;
import com.hooklight.core.model.TestVerificationResult;
import com.hooklight.core.state.HooksState;
import com.hooklight.core.state.PendingFix;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link TestVerifier}.
 * <p>
 * Mocks discovery and the runner so no test framework is started.
 */
class TestVerifierTest {

    private static final Path CWD = Path.of("/work/shop");

    private TestDiscovery discovery;
    private TestRunner runner;
    private TestVerifier verifier;

    @BeforeEach
    void setUp() {
        discovery = mock(TestDiscovery.class);
        runner = mock(TestRunner.class);
        verifier = new TestVerifier(discovery, runner);
    }

    @Nested
    @DisplayName("verify")
    class Verify {

        @Test
        @DisplayName("empty file list short-circuits without discovery")
        void emptyFiles() throws Exception {
            TestVerificationResult result = verifier.verify(CWD, List.of(), HooksState.defaults());

            assertFalse(result.ran());
            assertTrue(result.passed());
            assertEquals("No tests for modified files", result.summary());
            verifyNoInteractions(discovery, runner);
        }

        @Test
        @DisplayName("no discovered tests means not run and passed")
        void noTests() throws Exception {
            when(discovery.findTestsFor(eq(CWD), any())).thenReturn(List.of());

            TestVerificationResult result = verifier.verify(CWD, List.of("src/x.ts"), HooksState.defaults());

            assertFalse(result.ran());
            assertTrue(result.passed());
            assertEquals(TestVerificationResult.NO_TESTS_SUMMARY, result.summary());
            verify(runner, never()).runTests(anyList(), any());
        }

        @Test
        @DisplayName("runs deduplicated test files once")
        void runsOnceDeduplicated() throws Exception {
            when(discovery.findTestsFor(CWD, "src/a.ts")).thenReturn(List.of("src/a.test.ts", "src/shared.test.ts"));
            when(discovery.findTestsFor(CWD, "src/b.ts")).thenReturn(List.of("src/shared.test.ts"));
            when(runner.runTests(anyList(), any())).thenReturn(new TestRunResult(true, "2 test files passed", List.of()));

            TestVerificationResult result = verifier.verify(CWD, List.of("src/a.ts", "src/b.ts"), HooksState.defaults());

            verify(runner, times(1)).runTests(List.of("src/a.test.ts", "src/shared.test.ts"), CWD);
            assertTrue(result.ran());
            assertTrue(result.passed());
            assertEquals(List.of("src/a.test.ts", "src/shared.test.ts"),
                    result.state().getTests().getPassingFiles());
        }

        @Test
        @DisplayName("failures are recorded as failing files and pending fixes")
        void failuresRecorded() throws Exception {
            when(discovery.findTestsFor(CWD, "src/a.ts")).thenReturn(List.of("src/a.test.ts"));
            when(runner.runTests(anyList(), any())).thenReturn(new TestRunResult(false, "Tests failed",
                    List.of(new TestFailure("src/a.test.ts", "FAIL src/a.test.ts\nexpected 1"))));

            TestVerificationResult result = verifier.verify(CWD, List.of("src/a.ts"), HooksState.defaults());

            assertTrue(result.ran());
            assertFalse(result.passed());
            assertEquals(List.of("src/a.test.ts"), result.state().getTests().getFailingFiles());
            assertEquals(List.of(new PendingFix("src/a.test.ts", "FAIL src/a.test.ts\nexpected 1", 0)),
                    result.state().getTests().getPendingFixes());
        }

        @Test
        @DisplayName("a crashing runner is reported as not run")
        void runnerCrash() throws Exception {
            when(discovery.findTestsFor(CWD, "src/a.ts")).thenReturn(List.of("src/a.test.ts"));
            when(runner.runTests(anyList(), any())).thenThrow(new IOException("vitest missing"));

            TestVerificationResult result = verifier.verify(CWD, List.of("src/a.ts"), HooksState.defaults());

            assertFalse(result.ran());
            assertTrue(result.passed());
            assertTrue(result.summary().contains("vitest missing"));
        }
    }

    @Nested
    @DisplayName("applyOutcome")
    class ApplyOutcome {

        @Test
        @DisplayName("a pending fix is appended even when the file is already failing")
        void pendingFixAlwaysAppended() {
            HooksState state = HooksState.defaults();
            state.getTests().getFailingFiles().add("a.test.ts");
            state.getTests().getPendingFixes().add(new PendingFix("a.test.ts", "old", 2));

            var failed = new TestVerificationResult(true, false, "Tests failed", List.of("a.test.ts"),
                    List.of(new TestFailure("a.test.ts", "new")), null);
            HooksState next = TestVerifier.applyOutcome(state, failed);

            assertEquals(List.of("a.test.ts"), next.getTests().getFailingFiles());
            assertEquals(2, next.getTests().getPendingFixes().size());
            assertEquals(new PendingFix("a.test.ts", "new", 0), next.getTests().getPendingFixes().get(1));
            assertEquals(1, state.getTests().getPendingFixes().size());
        }

        @Test
        @DisplayName("passing files are unioned")
        void passingUnion() {
            HooksState state = HooksState.defaults();
            state.getTests().getPassingFiles().add("a.test.ts");

            var passed = new TestVerificationResult(true, true, "2 test files passed",
                    List.of("a.test.ts", "b.test.ts"), List.of(), null);

            assertEquals(List.of("a.test.ts", "b.test.ts"),
                    TestVerifier.applyOutcome(state, passed).getTests().getPassingFiles());
        }

        @Test
        @DisplayName("a run that did not happen leaves the state alone")
        void notRun() {
            HooksState state = HooksState.defaults();
            assertSame(state, TestVerifier.applyOutcome(state, TestVerificationResult.notRun("x", state)));
        }
    }
}
