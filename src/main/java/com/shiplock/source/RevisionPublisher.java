package com.shiplock.source;

import com.shiplock.core.model.Revision;

/**
 * Makes a revision available to the control plane's source store.
 */
@FunctionalInterface
public interface RevisionPublisher {

    /**
     * @throws com.shiplock.core.failure.PublishException if the revision could not be published
     */
    void publish(Revision revision);
}
