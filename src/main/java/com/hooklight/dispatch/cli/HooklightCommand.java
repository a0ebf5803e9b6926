package com.hooklight.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command for Hooklight.
 * Routes to subcommands: subagent-start, subagent-stop, cleanup.
 */
@Command(
        name = "hooklight",
        mixinStandardHelpOptions = true,
        version = "Hooklight 0.1.0",
        description = "Subagent lifecycle telemetry and correlation hooks",
        subcommands = {
                SubagentStartCommand.class,
                SubagentStopCommand.class,
                CleanupCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class HooklightCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        // When no subcommand is given, show usage help
        spec.commandLine().usage(System.out);
    }
}
