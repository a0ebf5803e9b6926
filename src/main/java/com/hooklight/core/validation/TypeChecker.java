package com.hooklight.core.validation;

import com.hooklight.core.model.TypeCheckResult;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Type-checks a whole project.
 */
public interface TypeChecker {

    /**
     * @throws IOException          if the checker cannot be started
     * @throws InterruptedException if interrupted while waiting for it
     */
    TypeCheckResult runTypeCheck(Path cwd) throws IOException, InterruptedException;
}
