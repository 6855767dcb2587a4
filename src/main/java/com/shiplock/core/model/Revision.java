package com.shiplock.core.model;

/**
 * An exact source state, usually a git commit hash.
 * <p>
 * Opaque to Shiplock: two revisions are the same iff their values are equal.
 */
public record Revision(String value) {

    public Revision {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("revision must not be blank");
        }
        value = value.trim();
    }

    public static Revision of(String value) {
        return new Revision(value);
    }

    /** Short form for console output, e.g. {@code abc1234}. */
    public String shortValue() {
        return value.length() > 12 ? value.substring(0, 12) : value;
    }

    @Override
    public String toString() {
        return value;
    }
}
