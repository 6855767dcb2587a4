package com.shiplock.core.status;

import com.shiplock.core.model.BuildHandle;
import com.shiplock.core.model.Outcome;

/**
 * Thrown when the control plane reports a terminal status for a build and later
 * reports something different for the same build.
 */
public class StatusContractViolationException extends RuntimeException {

    public StatusContractViolationException(BuildHandle handle, Outcome first, String laterRawStatus) {
        super("build %s was reported %s, then '%s'".formatted(handle, first, laterRawStatus));
    }
}
