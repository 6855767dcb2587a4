package com.shiplock.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Shiplock-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setRevision(String runId, String revision) {
        MDC.put("runId", runId);
        MDC.put("revision", revision);
    }

    public static void setPhase(String phase) {
        MDC.put("phase", phase);
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("revision");
        MDC.remove("phase");
    }
}
