package com.hooklight.core.engine;

import java.util.List;
import java.util.Map;

/**
 * Reads loosely typed hook input fields. The host runtime has used more than one name for
 * several fields, so lookups take a list of aliases and return the first non-empty value.
 */
final class HookInputs {

    private HookInputs() {}

    static String firstNonEmpty(Map<String, Object> input, String... keys) {
        if (input == null) {
            return null;
        }
        for (String key : keys) {
            Object value = input.get(key);
            if (value == null || value instanceof Map || value instanceof List) {
                continue;
            }
            String text = String.valueOf(value);
            if (!text.isEmpty()) {
                return text;
            }
        }
        return null;
    }

    static String orDefault(String value, String fallback) {
        return value != null ? value : fallback;
    }
}
