package com.shiplock.core.model;

/**
 * Identifier the control plane assigns to a submitted build.
 */
public record BuildHandle(String id) {

    public BuildHandle {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("build handle must not be blank");
        }
    }

    @Override
    public String toString() {
        return id;
    }
}
