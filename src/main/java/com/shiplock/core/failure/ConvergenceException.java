package com.shiplock.core.failure;

import com.shiplock.core.model.RunState;

/**
 * Base class for every fatal condition that ends a convergence run.
 * <p>
 * Each subclass maps to exactly one terminal {@link RunState}; the message is
 * the operator-facing line that names the phase and the condition.
 */
public abstract class ConvergenceException extends RuntimeException {

    private final RunState terminalState;

    protected ConvergenceException(RunState terminalState, String message) {
        super(message);
        this.terminalState = terminalState;
    }

    protected ConvergenceException(RunState terminalState, String message, Throwable cause) {
        super(message, cause);
        this.terminalState = terminalState;
    }

    public RunState terminalState() {
        return terminalState;
    }
}
