package com.hooklight.core.telemetry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.hooklight.core.config.HooklightProperties;
import com.hooklight.core.model.TelemetryRecord;
import com.hooklight.core.persistence.LockedFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Appends telemetry records to month-partitioned JSONL files,
 * {@code <data-dir>/telemetry/yyyy-MM.jsonl}, one JSON object per line. Files are never
 * rewritten.
 */
public class TelemetryWriter {

    private static final Logger log = LoggerFactory.getLogger(TelemetryWriter.class);

    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyy-MM");

    private final HooklightProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public TelemetryWriter(HooklightProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper.copy().disable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    /**
     * Appends {@code record} to the current month's file under {@code cwd}.
     *
     * @return the file written to
     */
    public Path write(Path cwd, TelemetryRecord record) throws IOException {
        Path file = currentFile(cwd);
        LockedFiles.appendLine(file, objectMapper.writeValueAsString(record));
        log.debug("Wrote telemetry for {} to {}", record.agentId(), file);
        return file;
    }

    public Path currentFile(Path cwd) {
        String month = YearMonth.now(clock.withZone(ZoneOffset.UTC)).format(MONTH);
        return properties.telemetryDir(cwd).resolve(month + ".jsonl");
    }
}
