package com.hooklight.dispatch.cli;

import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Bridges picocli with Spring Boot lifecycle.
 * Parses CLI arguments and delegates to the appropriate command.
 * <p>
 * Hook subcommands always finish with exit code 0 so the host runtime never blocks a subagent;
 * a non-zero code only comes from picocli itself, e.g. an unknown option.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private final HooklightCommand hooklightCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(HooklightCommand hooklightCommand, IFactory factory) {
        this.hooklightCommand = hooklightCommand;
        this.factory = factory;
    }

    @Override
    public void run(String... args) throws Exception {
        exitCode = new CommandLine(hooklightCommand, factory).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
