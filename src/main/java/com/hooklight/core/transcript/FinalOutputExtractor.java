package com.hooklight.core.transcript;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the subagent's last assistant message in a raw transcript.
 */
public final class FinalOutputExtractor {

    public static final int MAX_OUTPUT_LENGTH = 500;

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("\"role\"\\s*:\\s*\"assistant\"[^}]*\"content\"\\s*:\\s*\"([^\"]+)\""),
            Pattern.compile("Assistant:\\s*(.+?)(?=\\n\\n|Human:|\\z)", Pattern.DOTALL)
    );

    private FinalOutputExtractor() {}

    /**
     * Returns the match that starts last across both formats, cut to
     * {@value #MAX_OUTPUT_LENGTH} characters with {@code "..."} appended when longer.
     */
    public static Optional<String> extract(String content) {
        if (content == null || content.isEmpty()) {
            return Optional.empty();
        }
        String last = null;
        int lastStart = -1;
        for (Pattern pattern : PATTERNS) {
            Matcher m = pattern.matcher(content);
            while (m.find()) {
                if (m.start() >= lastStart) {
                    lastStart = m.start();
                    last = m.group(1);
                }
            }
        }
        return Optional.ofNullable(last).map(FinalOutputExtractor::truncate);
    }

    static String truncate(String text) {
        return text.length() > MAX_OUTPUT_LENGTH ? text.substring(0, MAX_OUTPUT_LENGTH) + "..." : text;
    }
}
