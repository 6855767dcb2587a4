package com.shiplock.core.logging;

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
    @DisplayName("setRun puts runId in MDC")
    void setRun() {
        MdcContext.setRun("SHIP-3f9a1c2e");
        assertEquals("SHIP-3f9a1c2e", MDC.get("runId"));
    }

    @Test
    @DisplayName("setRevision puts runId and revision in MDC")
    void setRevision() {
        MdcContext.setRevision("SHIP-3f9a1c2e", "abc123");
        assertEquals("SHIP-3f9a1c2e", MDC.get("runId"));
        assertEquals("abc123", MDC.get("revision"));
    }

    @Test
    @DisplayName("setPhase puts phase in MDC")
    void setPhase() {
        MdcContext.setPhase("build");
        assertEquals("build", MDC.get("phase"));
    }

    @Test
    @DisplayName("clear removes all Shiplock keys and keeps others")
    void clear() {
        MDC.put("other", "kept");
        MdcContext.setRevision("SHIP-1", "abc123");
        MdcContext.setPhase("deploy");

        MdcContext.clear();

        assertNull(MDC.get("runId"));
        assertNull(MDC.get("revision"));
        assertNull(MDC.get("phase"));
        assertEquals("kept", MDC.get("other"));
        MDC.remove("other");
    }
}
