package com.browserpilot.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setSession puts sessionId in MDC")
    void setSession() {
        MdcContext.setSession("BP-2026-0001");
        assertEquals("BP-2026-0001", MDC.get("sessionId"));
    }

    @Test
    @DisplayName("setNode puts node and step in MDC, clearNode keeps the session")
    void setNode() {
        MdcContext.setSession("BP-2026-0001");
        MdcContext.setNode("reasoning", 7);
        assertEquals("reasoning", MDC.get("node"));
        assertEquals("7", MDC.get("step"));

        MdcContext.clearNode();
        assertNull(MDC.get("node"));
        assertNull(MDC.get("step"));
        assertEquals("BP-2026-0001", MDC.get("sessionId"));
    }

    @Test
    @DisplayName("clear removes all browser-pilot MDC keys")
    void clear() {
        MdcContext.setSession("BP-2026-0001");
        MdcContext.setNode("tool_execution", 2);
        MdcContext.clear();
        assertNull(MDC.get("sessionId"));
        assertNull(MDC.get("node"));
        assertNull(MDC.get("step"));
    }
}
