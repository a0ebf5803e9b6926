package com.hooklight.core.git;

import com.hooklight.core.config.HooklightProperties;
import com.hooklight.core.model.GitInfo;
import com.hooklight.core.process.CommandResult;
import com.hooklight.core.process.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads branch and short commit hash by shelling out to the {@code git} CLI.
 * <p>
 * The two lookups are independent: a repository without commits still reports its branch,
 * and a directory outside any repository reports neither.
 */
public class GitInfoService implements GitInfoProvider {

    private static final Logger log = LoggerFactory.getLogger(GitInfoService.class);

    private final CommandRunner commandRunner;
    private final HooklightProperties properties;

    public GitInfoService(CommandRunner commandRunner, HooklightProperties properties) {
        this.commandRunner = commandRunner;
        this.properties = properties;
    }

    @Override
    public GitInfo getGitInfo(Path cwd) {
        String branch = runGitOutput(cwd, "rev-parse", "--abbrev-ref", "HEAD");
        String commit = runGitOutput(cwd, "rev-parse", "--short", "HEAD");
        return new GitInfo(branch, commit);
    }

    /**
     * Runs a git command and returns its trimmed output, or null on any failure.
     */
    String runGitOutput(Path workDir, String... args) {
        var command = new ArrayList<String>(List.of("git"));
        command.addAll(List.of(args));
        try {
            CommandResult result = commandRunner.run(command, workDir, properties.getGit().getTimeout());
            if (!result.succeeded()) {
                log.debug("git {} exited with code {} in {}", String.join(" ", args), result.exitCode(), workDir);
                return null;
            }
            String output = result.output().trim();
            return output.isEmpty() ? null : output;
        } catch (IOException e) {
            log.debug("Could not run git {} in {}: {}", String.join(" ", args), workDir, e.getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while running git {}", String.join(" ", args));
            return null;
        }
    }
}
