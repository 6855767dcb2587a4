package com.shiplock.core.failure;

import com.shiplock.core.model.RunState;

/**
 * Thrown when the control plane does not accept a build submission. Never retried.
 */
public class SubmissionException extends ConvergenceException {

    public SubmissionException(String message, Throwable cause) {
        super(RunState.SUBMISSION_FAILED, "build submission failed: " + message, cause);
    }
}
