package com.shiplock.core.poll;

/**
 * Result of a single {@link PollCondition} evaluation.
 *
 * @param kind   whether polling should continue
 * @param value  success value, {@code null} otherwise
 * @param detail last observed status or revision, used in progress lines and failures
 */
public record PollDecision<T>(Kind kind, T value, String detail) {

    public enum Kind { PENDING, SUCCESS, FAILURE }

    public static <T> PollDecision<T> pending(String detail) {
        return new PollDecision<>(Kind.PENDING, null, detail);
    }

    public static <T> PollDecision<T> success(T value, String detail) {
        return new PollDecision<>(Kind.SUCCESS, value, detail);
    }

    public static <T> PollDecision<T> failure(String detail) {
        return new PollDecision<>(Kind.FAILURE, null, detail);
    }
}
