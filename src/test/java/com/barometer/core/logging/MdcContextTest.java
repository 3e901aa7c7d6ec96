package com.barometer.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("setAgent and setTarget populate the MDC")
    void setsKeys() {
        MdcContext.setAgent("filesystem");
        MdcContext.setTarget("/home");

        assertEquals("filesystem", MDC.get("agent"));
        assertEquals("/home", MDC.get("target"));
    }

    @Test
    @DisplayName("clearTarget keeps the agent")
    void clearTargetKeepsAgent() {
        MdcContext.setAgent("network");
        MdcContext.setTarget("eth0");

        MdcContext.clearTarget();

        assertEquals("network", MDC.get("agent"));
        assertNull(MDC.get("target"));
    }

    @Test
    @DisplayName("clear removes both keys and leaves others alone")
    void clearRemovesOwnKeys() {
        MDC.put("other", "value");
        MdcContext.setAgent("cpu");
        MdcContext.setTarget("cpu");

        MdcContext.clear();

        assertNull(MDC.get("agent"));
        assertNull(MDC.get("target"));
        assertEquals("value", MDC.get("other"));
    }
}
