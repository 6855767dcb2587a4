package com.shiplock.remote;

/**
 * The control plane answered, but refused the call or returned an unusable body.
 */
public class RemoteRejectedException extends RemoteControlException {

    public RemoteRejectedException(String message) {
        super(message);
    }

    public RemoteRejectedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
