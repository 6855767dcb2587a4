package com.shiplock.core.failure;

import com.shiplock.core.model.RunState;

/**
 * Thrown when the target revision cannot be determined.
 */
public class ResolutionException extends ConvergenceException {

    public ResolutionException(String message) {
        super(RunState.RESOLUTION_FAILED, "revision resolution failed: " + message);
    }

    public ResolutionException(String message, Throwable cause) {
        super(RunState.RESOLUTION_FAILED, "revision resolution failed: " + message, cause);
    }
}
