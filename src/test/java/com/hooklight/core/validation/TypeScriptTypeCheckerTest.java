package com.hooklight.core.validation;

import com.hooklight.core.config.HooklightProperties;
import com.hooklight.core.model.TypeCheckResult;
import com.hooklight.core.process.CommandResult;
import com.hooklight.core.process.CommandRunner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class TypeScriptTypeCheckerTest {

    private static final Path CWD = Path.of("/work/shop");

    @Test
    @DisplayName("parses tsc diagnostics into file:line - message")
    void parsesDiagnostics() {
        String output = """
                src/a.ts(12,5): error TS2322: Type 'string' is not assignable to type 'number'.
                src/b.tsx(3,1): error TS2304: Cannot find name 'foo'.
                Found 2 errors.
                """;
        assertEquals(List.of(
                "src/a.ts:12 - Type 'string' is not assignable to type 'number'.",
                "src/b.tsx:3 - Cannot find name 'foo'."), TypeScriptTypeChecker.parseErrors(output));
    }

    @Test
    @DisplayName("runs the configured command with the verification timeout")
    void runsConfiguredCommand() throws Exception {
        var runner = mock(CommandRunner.class);
        var properties = new HooklightProperties();
        when(runner.run(List.of("npx", "tsc", "--noEmit"), CWD, Duration.ofSeconds(120)))
                .thenReturn(new CommandResult(0, "", false));

        TypeCheckResult result = new TypeScriptTypeChecker(runner, properties).runTypeCheck(CWD);

        assertTrue(result.passed());
        assertEquals(0, result.errorCount());
    }

    @Test
    @DisplayName("non-zero exit reports the parsed error count")
    void failingCheck() throws Exception {
        var runner = mock(CommandRunner.class);
        when(runner.run(eq(List.of("npx", "tsc", "--noEmit")), eq(CWD), eq(Duration.ofSeconds(120))))
                .thenReturn(new CommandResult(2, "x.ts(1,1): error TS1005: ';' expected.\n", false));

        TypeCheckResult result = new TypeScriptTypeChecker(runner, new HooklightProperties()).runTypeCheck(CWD);

        assertFalse(result.passed());
        assertEquals(1, result.errorCount());
    }
}
