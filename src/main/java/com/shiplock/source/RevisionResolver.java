package com.shiplock.source;

import com.shiplock.core.model.Revision;

/**
 * Determines which revision a run converges to.
 */
@FunctionalInterface
public interface RevisionResolver {

    /**
     * @throws com.shiplock.core.failure.ResolutionException if no revision can be determined
     */
    Revision resolve();
}
