package com.hooklight.core.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 * <p>
 * Output goes to a temp file rather than a pipe, so a chatty process cannot block on a full
 * buffer while we wait for it.
 */
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessCommandRunner.class);

    @Override
    public CommandResult run(List<String> command, Path workDir, Duration timeout)
            throws IOException, InterruptedException {
        log.debug("Running: {} (in {}, timeout {})", String.join(" ", command), workDir, timeout);
        Path outputFile = Files.createTempFile("hooklight-cmd-", ".log");
        Process process = null;
        try {
            process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(outputFile.toFile())
                    .start();

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                log.warn("Command timed out after {}: {}", timeout, String.join(" ", command));
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
                return new CommandResult(-1, readOutput(outputFile), true);
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                log.debug("Command exited with code {}: {}", exitCode, String.join(" ", command));
            }
            return new CommandResult(exitCode, readOutput(outputFile), false);
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            try {
                Files.deleteIfExists(outputFile);
            } catch (IOException e) {
                log.debug("Could not delete temp output {}: {}", outputFile, e.getMessage());
            }
        }
    }

    private static String readOutput(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }
}
