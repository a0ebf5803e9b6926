package com.hooklight.core.transcript;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fallback for free-text lines: finds tool names, file paths and error markers with patterns.
 * Always accepts the line.
 */
public class PlainTextStrategy implements LineStrategy {

    private static final List<Pattern> TOOL_PATTERNS = List.of(
            Pattern.compile("using\\s+(\\w+)\\s+tool", Pattern.CASE_INSENSITIVE),
            Pattern.compile("calling\\s+(\\w+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("<tool_use\\s+name=\"(\\w+)\"", Pattern.CASE_INSENSITIVE),
            Pattern.compile("invoke\\s+name=\"(\\w+)\"", Pattern.CASE_INSENSITIVE)
    );

    private static final List<Pattern> FILE_PATTERNS = List.of(
            Pattern.compile("(?:writing|editing|creating|modifying)\\s+[\"']?([^\\s\"']+\\.[a-z]{1,4})[\"']?",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("file[_\\s]path[\"']?\\s*[:=]\\s*[\"']([^\"']+)[\"']", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?<!\\w)path[\"']?\\s*[:=]\\s*[\"']([^\"']+)[\"']", Pattern.CASE_INSENSITIVE)
    );

    private static final List<String> ERROR_MARKERS = List.of("error:", "failed:", "exception");

    @Override
    public boolean apply(String line, TranscriptAccumulator acc) {
        for (Pattern pattern : TOOL_PATTERNS) {
            Matcher m = pattern.matcher(line);
            if (m.find()) {
                acc.addTool(m.group(1));
            }
        }
        for (Pattern pattern : FILE_PATTERNS) {
            Matcher m = pattern.matcher(line);
            if (m.find()) {
                acc.addFile(m.group(1));
            }
        }
        String lower = line.toLowerCase(Locale.ROOT);
        for (String marker : ERROR_MARKERS) {
            if (lower.contains(marker)) {
                acc.incrementErrors();
                break;
            }
        }
        return true;
    }
}
