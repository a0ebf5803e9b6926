package com.hooklight.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Hooklight-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setAgent(String agentId, String agentType) {
        putIfPresent("agentId", agentId);
        putIfPresent("agentType", agentType);
    }

    public static void setSession(String sessionId) {
        putIfPresent("sessionId", sessionId);
    }

    public static void clear() {
        MDC.remove("agentId");
        MDC.remove("agentType");
        MDC.remove("sessionId");
    }

    private static void putIfPresent(String key, String value) {
        if (value != null && !value.isEmpty()) {
            MDC.put(key, value);
        }
    }
}
