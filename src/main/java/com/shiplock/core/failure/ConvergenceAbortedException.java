package com.shiplock.core.failure;

import com.shiplock.core.model.RunState;

/**
 * Thrown when the caller cancels a run between or during poll ticks.
 */
public class ConvergenceAbortedException extends ConvergenceException {

    public ConvergenceAbortedException(String phase) {
        super(RunState.ABORTED, phase + " aborted: cancelled by caller");
    }
}
