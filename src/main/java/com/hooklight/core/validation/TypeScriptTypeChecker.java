package com.hooklight.core.validation;

import com.hooklight.core.config.HooklightProperties;
import com.hooklight.core.model.TypeCheckResult;
import com.hooklight.core.process.CommandResult;
import com.hooklight.core.process.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs the configured type-check command ({@code npx tsc --noEmit} by default) and parses
 * compiler diagnostics of the form {@code file(line,col): error TS1234: message}.
 */
public class TypeScriptTypeChecker implements TypeChecker {

    private static final Logger log = LoggerFactory.getLogger(TypeScriptTypeChecker.class);

    private static final Pattern TS_ERROR = Pattern.compile("(.+)\\((\\d+),\\d+\\):\\s*error\\s*TS\\d+:\\s*(.+)");

    private final CommandRunner commandRunner;
    private final HooklightProperties properties;

    public TypeScriptTypeChecker(CommandRunner commandRunner, HooklightProperties properties) {
        this.commandRunner = commandRunner;
        this.properties = properties;
    }

    @Override
    public TypeCheckResult runTypeCheck(Path cwd) throws IOException, InterruptedException {
        var verification = properties.getVerification();
        CommandResult result = commandRunner.run(verification.getTypeCheckCommand(), cwd, verification.getTimeout());
        if (result.succeeded()) {
            return TypeCheckResult.ok();
        }
        if (result.timedOut()) {
            log.warn("Type check timed out in {}", cwd);
        }
        List<String> errors = parseErrors(result.output());
        return new TypeCheckResult(false, errors.size(), errors);
    }

    /**
     * Extracts {@code file:line - message} entries from compiler output.
     */
    static List<String> parseErrors(String output) {
        var errors = new ArrayList<String>();
        for (String line : output.split("\n")) {
            Matcher m = TS_ERROR.matcher(line);
            if (m.find()) {
                errors.add(m.group(1).trim() + ":" + m.group(2) + " - " + m.group(3).trim());
            }
        }
        return errors;
    }
}
