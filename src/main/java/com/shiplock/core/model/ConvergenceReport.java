package com.shiplock.core.model;

import java.time.Duration;
import java.util.Optional;

/**
 * Final result of one convergence run.
 *
 * @param runId       random identifier for log correlation
 * @param revision    the target revision, {@code null} if resolution failed
 * @param finalState  terminal {@link RunState}
 * @param buildHandle build id, {@code null} if no build was submitted
 * @param message     operator-facing summary naming the phase and condition
 * @param elapsed     wall time of the whole run
 */
public record ConvergenceReport(
        String runId,
        Revision revision,
        RunState finalState,
        BuildHandle buildHandle,
        String message,
        Duration elapsed
) {

    public ConvergenceReport {
        if (!finalState.isTerminal()) {
            throw new IllegalArgumentException("report requires a terminal state, got " + finalState);
        }
    }

    public boolean converged() {
        return finalState.isSuccess();
    }

    public int exitCode() {
        return finalState.exitCode();
    }

    public Optional<Revision> revisionIfResolved() {
        return Optional.ofNullable(revision);
    }
}
