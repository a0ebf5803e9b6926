package com.hooklight.core.git;

import com.hooklight.core.config.HooklightProperties;
import com.hooklight.core.model.GitInfo;
import com.hooklight.core.process.CommandResult;
import com.hooklight.core.process.CommandRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class GitInfoServiceTest {

    private static final Path CWD = Path.of("/work/shop");
    private static final List<String> BRANCH = List.of("git", "rev-parse", "--abbrev-ref", "HEAD");
    private static final List<String> COMMIT = List.of("git", "rev-parse", "--short", "HEAD");

    private CommandRunner runner;
    private GitInfoService service;

    @BeforeEach
    void setUp() {
        runner = mock(CommandRunner.class);
        service = new GitInfoService(runner, new HooklightProperties());
    }

    @Test
    @DisplayName("returns trimmed branch and commit")
    void bothParts() throws Exception {
        when(runner.run(BRANCH, CWD, Duration.ofSeconds(30))).thenReturn(new CommandResult(0, "main\n", false));
        when(runner.run(COMMIT, CWD, Duration.ofSeconds(30))).thenReturn(new CommandResult(0, "abc1234\n", false));

        assertEquals(new GitInfo("main", "abc1234"), service.getGitInfo(CWD));
    }

    @Test
    @DisplayName("a failing commit lookup still reports the branch")
    void partialFailure() throws Exception {
        when(runner.run(eq(BRANCH), any(), any())).thenReturn(new CommandResult(0, "feature/x", false));
        when(runner.run(eq(COMMIT), any(), any()))
                .thenReturn(new CommandResult(128, "fatal: ambiguous argument 'HEAD'", false));

        assertEquals(new GitInfo("feature/x", null), service.getGitInfo(CWD));
    }

    @Test
    @DisplayName("a missing git binary yields no info and no exception")
    void gitMissing() throws Exception {
        when(runner.run(any(), any(), any())).thenThrow(new IOException("Cannot run program \"git\""));

        assertEquals(GitInfo.none(), service.getGitInfo(CWD));
    }

    @Test
    @DisplayName("a timed-out lookup yields null for that part")
    void timeout() throws Exception {
        when(runner.run(eq(BRANCH), any(), any())).thenReturn(new CommandResult(-1, "", true));
        when(runner.run(eq(COMMIT), any(), any())).thenReturn(new CommandResult(0, "abc1234", false));

        assertEquals(new GitInfo(null, "abc1234"), service.getGitInfo(CWD));
    }
}
