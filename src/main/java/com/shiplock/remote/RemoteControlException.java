package com.shiplock.remote;

/**
 * Any failure talking to the control plane.
 */
public abstract class RemoteControlException extends RuntimeException {

    protected RemoteControlException(String message) {
        super(message);
    }

    protected RemoteControlException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Whether the same call may succeed if simply repeated later. */
    public abstract boolean isTransient();
}
