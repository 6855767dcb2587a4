package com.shiplock.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a convergence run, used for console rendering.
 *
 * @param eventType event type (e.g. "build.submitted", "deploy.progress", "run.converged")
 * @param runId     the run this event belongs to
 * @param phase     "source", "build" or "deploy"
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record ShiplockEvent(
    String eventType,
    String runId,
    String phase,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static ShiplockEvent of(String eventType, String runId, String phase, Map<String, Object> payload) {
        return new ShiplockEvent(eventType, runId, phase, payload, Instant.now());
    }
}
