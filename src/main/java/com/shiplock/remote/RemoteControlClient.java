package com.shiplock.remote;

import com.shiplock.core.model.BuildHandle;
import com.shiplock.core.model.BuildRecord;
import com.shiplock.core.model.Revision;

import java.util.List;

/**
 * Gateway to the build-and-deploy control plane.
 *
 * <p>Every method is a single synchronous round trip. Implementations throw
 * {@link RemoteTransportException} for failures worth retrying (I/O, timeouts,
 * server errors) and {@link RemoteRejectedException} when the control plane
 * explicitly refuses the call or answers with something unusable.
 */
public interface RemoteControlClient {

    /**
     * Requests a build of {@code revision}.
     *
     * @return the id of the new build
     * @throws RemoteRejectedException if the acknowledgement carries no build id
     */
    BuildHandle submitBuild(Revision revision);

    /**
     * Lists recent builds. Order is unspecified; callers search by handle.
     * A build submitted moments ago may not be listed yet.
     */
    List<BuildRecord> listRecentBuilds(int limit);

    /**
     * Asks the control plane to make {@code revision} the live one.
     * Safe to call when it already is.
     */
    void requestDeployment(Revision revision);

    /**
     * Returns the revision currently live, or an empty string if nothing is deployed.
     */
    String getDeployedRevision();

    /** Short description of the endpoint, for logs and health output. */
    String describe();
}
