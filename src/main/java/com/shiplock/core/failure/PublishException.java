package com.shiplock.core.failure;

import com.shiplock.core.model.RunState;

/**
 * Thrown when the revision cannot be pushed to the remote the control plane builds from.
 */
public class PublishException extends ConvergenceException {

    public PublishException(String message) {
        super(RunState.PUBLISH_FAILED, "publish failed: " + message);
    }

    public PublishException(String message, Throwable cause) {
        super(RunState.PUBLISH_FAILED, "publish failed: " + message, cause);
    }
}
