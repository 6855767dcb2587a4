package com.shiplock.core.poll;

/**
 * One evaluation of a polled condition: a single remote call plus classification.
 *
 * @param <T> value produced on success
 */
@FunctionalInterface
public interface PollCondition<T> {

    PollDecision<T> evaluate();
}
