package com.hooklight.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Settings for the hook commands, bound from {@code hooklight.*}.
 */
@Component
@ConfigurationProperties(prefix = "hooklight")
public class HooklightProperties {

    private String dataDir = ".hooklight";
    private Registry registry = new Registry();
    private Git git = new Git();
    private Verification verification = new Verification();

    // -- Path helpers, all relative to the project the hook fired in --
    public Path dataDir(Path cwd) { return cwd.resolve(dataDir); }
    public Path activeAgentsFile(Path cwd) { return dataDir(cwd).resolve("state").resolve("active-agents.json"); }
    public Path hooksStateFile(Path cwd) { return dataDir(cwd).resolve("state").resolve("hooks-state.json"); }
    public Path telemetryDir(Path cwd) { return dataDir(cwd).resolve("telemetry"); }

    public String getDataDir() { return dataDir; }
    public void setDataDir(String dataDir) { this.dataDir = dataDir; }
    public Registry getRegistry() { return registry; }
    public void setRegistry(Registry registry) { this.registry = registry; }
    public Git getGit() { return git; }
    public void setGit(Git git) { this.git = git; }
    public Verification getVerification() { return verification; }
    public void setVerification(Verification verification) { this.verification = verification; }

    public static class Registry {
        private Duration staleAfter = Duration.ofHours(24);
        private int taskDescriptionMaxLength = 200;

        public Duration getStaleAfter() { return staleAfter; }
        public void setStaleAfter(Duration staleAfter) { this.staleAfter = staleAfter; }
        public int getTaskDescriptionMaxLength() { return taskDescriptionMaxLength; }
        public void setTaskDescriptionMaxLength(int taskDescriptionMaxLength) { this.taskDescriptionMaxLength = taskDescriptionMaxLength; }
    }

    public static class Git {
        private Duration timeout = Duration.ofSeconds(30);

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class Verification {
        private Duration timeout = Duration.ofSeconds(120);
        private List<String> typedExtensions = List.of(".ts", ".tsx", ".mts", ".cts");
        private List<String> typeCheckCommand = List.of("npx", "tsc", "--noEmit");
        private List<String> testCommand = List.of("npx", "vitest", "run");

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
        public List<String> getTypedExtensions() { return typedExtensions; }
        public void setTypedExtensions(List<String> typedExtensions) { this.typedExtensions = typedExtensions; }
        public List<String> getTypeCheckCommand() { return typeCheckCommand; }
        public void setTypeCheckCommand(List<String> typeCheckCommand) { this.typeCheckCommand = typeCheckCommand; }
        public List<String> getTestCommand() { return testCommand; }
        public void setTestCommand(List<String> testCommand) { this.testCommand = testCommand; }
    }
}
