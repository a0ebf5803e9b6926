package com.hooklight.core.testing;

import com.hooklight.core.model.TestRunResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs a set of test files in one go.
 */
public interface TestRunner {

    TestRunResult runTests(List<String> testFiles, Path cwd) throws IOException, InterruptedException;
}
