package com.hooklight.core.validation;

import com.hooklight.core.config.HooklightProperties;
import com.hooklight.core.model.ParsedTranscript;
import com.hooklight.core.model.TypeCheckResult;
import com.hooklight.core.model.ValidationResult;
import com.hooklight.core.state.FileTracker;
import com.hooklight.core.state.HooksState;
import com.hooklight.core.transcript.TranscriptParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Checks what a subagent left behind: records the files it modified in the session state and,
 * when typed source files were touched, type-checks the project once.
 */
public class OutputValidator {

    private static final Logger log = LoggerFactory.getLogger(OutputValidator.class);

    private final TranscriptParser transcriptParser;
    private final TypeChecker typeChecker;
    private final HooklightProperties properties;

    public OutputValidator(TranscriptParser transcriptParser, TypeChecker typeChecker,
                           HooklightProperties properties) {
        this.transcriptParser = transcriptParser;
        this.typeChecker = typeChecker;
        this.properties = properties;
    }

    public ValidationResult validate(Path cwd, Path transcriptPath, HooksState state) {
        ParsedTranscript transcript = transcriptParser.parse(transcriptPath);
        List<String> filesModified = transcript.filesModified();

        HooksState next = state;
        for (String file : filesModified) {
            next = FileTracker.trackModification(next, file);
        }

        var errors = new ArrayList<String>();
        if (filesModified.stream().anyMatch(this::isTyped)) {
            typeCheck(cwd).ifPresent(errors::add);
        }

        log.debug("Validated {} modified files, {} errors", filesModified.size(), errors.size());
        return new ValidationResult(errors.isEmpty(), filesModified, errors, next, transcript);
    }

    private Optional<String> typeCheck(Path cwd) {
        try {
            TypeCheckResult result = typeChecker.runTypeCheck(cwd);
            if (!result.passed()) {
                return Optional.of("Type errors after agent work: " + result.errorCount() + " errors");
            }
        } catch (IOException e) {
            log.warn("Type check could not run in {}: {}", cwd, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Type check interrupted in {}", cwd);
        }
        return Optional.empty();
    }

    boolean isTyped(String file) {
        String lower = file.toLowerCase(Locale.ROOT);
        return properties.getVerification().getTypedExtensions().stream()
                .anyMatch(ext -> lower.endsWith(ext.toLowerCase(Locale.ROOT)));
    }
}
