package com.shiplock.core.model;

/**
 * Classified build status. Only {@code StatusClassifier} produces these.
 */
public enum Outcome {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED,
    UNKNOWN;     // unrecognised token, treated as still in progress

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
