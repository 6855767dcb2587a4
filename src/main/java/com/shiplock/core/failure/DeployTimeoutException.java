package com.shiplock.core.failure;

import com.shiplock.core.model.RunState;

import java.time.Duration;

/**
 * Thrown when the live revision did not match the target within the deploy timeout.
 */
public class DeployTimeoutException extends ConvergenceException {

    private final Duration elapsed;
    private final String lastObserved;

    public DeployTimeoutException(Duration elapsed, String lastObserved, String expected) {
        super(RunState.DEPLOY_TIMEOUT,
                "deploy timeout after %ds: deployed=%s expected=%s"
                        .formatted(elapsed.toSeconds(), lastObserved, expected));
        this.elapsed = elapsed;
        this.lastObserved = lastObserved;
    }

    public Duration elapsed() {
        return elapsed;
    }

    public String lastObserved() {
        return lastObserved;
    }
}
