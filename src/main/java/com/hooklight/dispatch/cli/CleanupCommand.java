package com.hooklight.dispatch.cli;

import com.hooklight.core.engine.SubagentLifecycleEngine;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.time.Duration;

/**
 * CLI command: hooklight cleanup [--cwd DIR] [--max-age-hours N]
 * <p>
 * Evicts registry entries of subagents that never reported completion.
 */
@Command(name = "cleanup", mixinStandardHelpOptions = true,
        description = "Remove stale active agent entries")
@Component
public class CleanupCommand implements Runnable {

    @Option(names = {"--cwd"}, description = "Project directory (default: current directory)")
    private Path cwd;

    @Option(names = {"--max-age-hours"}, description = "Evict entries older than this (default: ${DEFAULT-VALUE})",
            defaultValue = "24")
    private long maxAgeHours;

    private final SubagentLifecycleEngine engine;

    public CleanupCommand(SubagentLifecycleEngine engine) {
        this.engine = engine;
    }

    @Override
    public void run() {
        Path dir = (cwd != null ? cwd : Path.of("")).toAbsolutePath().normalize();
        int evicted = engine.cleanup(dir, Duration.ofHours(maxAgeHours));
        System.out.println("Removed " + evicted + " stale agent entries from " + dir);
    }
}
