package com.shiplock.core.failure;

import com.shiplock.core.model.RunState;

/**
 * Thrown when the control plane refuses or fails to acknowledge a deployment request.
 */
public class DeploymentRequestException extends ConvergenceException {

    public DeploymentRequestException(String message, Throwable cause) {
        super(RunState.DEPLOY_REQUEST_FAILED, "deployment request failed: " + message, cause);
    }
}
