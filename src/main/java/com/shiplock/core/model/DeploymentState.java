package com.shiplock.core.model;

import java.util.Objects;

/**
 * What was asked for versus what the control plane reports as live.
 *
 * @param requestedRevision        the revision being converged to
 * @param observedDeployedRevision last observed live revision, empty string when nothing is deployed
 */
public record DeploymentState(Revision requestedRevision, String observedDeployedRevision) {

    public DeploymentState {
        Objects.requireNonNull(requestedRevision, "requestedRevision");
        observedDeployedRevision = observedDeployedRevision == null ? "" : observedDeployedRevision;
    }

    public boolean isConverged() {
        return requestedRevision.value().equals(observedDeployedRevision);
    }
}
