package com.hooklight.core.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HooklightPropertiesTest {

    @Test
    void defaultsAreReasonable() {
        var props = new HooklightProperties();
        assertEquals(".hooklight", props.getDataDir());
        assertEquals(Duration.ofHours(24), props.getRegistry().getStaleAfter());
        assertEquals(200, props.getRegistry().getTaskDescriptionMaxLength());
        assertEquals(Duration.ofSeconds(30), props.getGit().getTimeout());
        assertEquals(Duration.ofSeconds(120), props.getVerification().getTimeout());
    }

    @Test
    void verificationDefaultsTargetTypeScript() {
        var verification = new HooklightProperties().getVerification();
        assertTrue(verification.getTypedExtensions().containsAll(List.of(".ts", ".tsx")));
        assertEquals(List.of("npx", "tsc", "--noEmit"), verification.getTypeCheckCommand());
        assertEquals(List.of("npx", "vitest", "run"), verification.getTestCommand());
    }

    @Test
    void pathsResolveUnderDataDir() {
        var props = new HooklightProperties();
        Path cwd = Path.of("/work/shop");
        assertEquals(Path.of("/work/shop/.hooklight/state/active-agents.json"), props.activeAgentsFile(cwd));
        assertEquals(Path.of("/work/shop/.hooklight/state/hooks-state.json"), props.hooksStateFile(cwd));
        assertEquals(Path.of("/work/shop/.hooklight/telemetry"), props.telemetryDir(cwd));
    }

    @Test
    void customDataDirIsUsed() {
        var props = new HooklightProperties();
        props.setDataDir(".telemetry");
        assertEquals(Path.of("/p/.telemetry/telemetry"), props.telemetryDir(Path.of("/p")));
    }
}
