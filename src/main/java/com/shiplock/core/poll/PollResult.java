package com.shiplock.core.poll;

import java.time.Duration;

/**
 * How a {@link PollUntil} loop ended.
 */
public record PollResult<T>(Status status, T value, String detail, int attempts, Duration elapsed) {

    public enum Status { SUCCEEDED, FAILED, TIMED_OUT, CANCELLED }

    public boolean succeeded() {
        return status == Status.SUCCEEDED;
    }
}
