package com.shiplock.core.failure;

import com.shiplock.core.model.BuildHandle;
import com.shiplock.core.model.RunState;

import java.time.Duration;

/**
 * Thrown when the build did not reach a terminal status within the build timeout.
 */
public class BuildTimeoutException extends ConvergenceException {

    private final BuildHandle handle;
    private final Duration elapsed;
    private final String lastStatus;

    public BuildTimeoutException(BuildHandle handle, Duration elapsed, String lastStatus) {
        super(RunState.BUILD_TIMEOUT,
                "build timeout after %ds, last status=%s".formatted(elapsed.toSeconds(), lastStatus));
        this.handle = handle;
        this.elapsed = elapsed;
        this.lastStatus = lastStatus;
    }

    public BuildHandle handle() {
        return handle;
    }

    public Duration elapsed() {
        return elapsed;
    }

    public String lastStatus() {
        return lastStatus;
    }
}
