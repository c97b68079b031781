package com.browserpilot.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing browser-pilot MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSession(String sessionId) {
        MDC.put("sessionId", sessionId);
    }

    public static void setNode(String nodeId, long step) {
        MDC.put("node", nodeId);
        MDC.put("step", String.valueOf(step));
    }

    public static void clearNode() {
        MDC.remove("node");
        MDC.remove("step");
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("node");
        MDC.remove("step");
    }
}
