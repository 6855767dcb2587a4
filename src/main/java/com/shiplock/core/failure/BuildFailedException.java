package com.shiplock.core.failure;

import com.shiplock.core.model.BuildHandle;
import com.shiplock.core.model.RunState;

/**
 * Thrown when the build reaches a failed or cancelled status.
 */
public class BuildFailedException extends ConvergenceException {

    private final BuildHandle handle;
    private final String rawStatus;

    public BuildFailedException(BuildHandle handle, String rawStatus) {
        super(RunState.BUILD_FAILED, "build failed: status=" + rawStatus);
        this.handle = handle;
        this.rawStatus = rawStatus;
    }

    public BuildFailedException(BuildHandle handle, String rawStatus, Throwable cause) {
        super(RunState.BUILD_FAILED, "build failed: " + cause.getMessage(), cause);
        this.handle = handle;
        this.rawStatus = rawStatus;
    }

    public BuildHandle handle() {
        return handle;
    }

    public String rawStatus() {
        return rawStatus;
    }
}
