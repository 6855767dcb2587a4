package com.shiplock.remote;

/**
 * Network, timeout or server-side failure. Retried by poll loops.
 */
public class RemoteTransportException extends RemoteControlException {

    public RemoteTransportException(String message) {
        super(message);
    }

    public RemoteTransportException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
