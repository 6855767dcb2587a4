package com.shiplock.core.engine;

import com.shiplock.core.model.PollConfig;
import com.shiplock.core.poll.CancellationToken;

import java.util.Objects;

/**
 * Parameters of one convergence run.
 *
 * @param explicitRevision revision to converge to; {@code null} or blank resolves the local HEAD
 * @param publish          whether to push the revision before building
 * @param buildConfig      build phase cadence
 * @param deployConfig     deploy phase cadence
 * @param token            caller cancellation signal
 */
public record ConvergenceRequest(
        String explicitRevision,
        boolean publish,
        PollConfig buildConfig,
        PollConfig deployConfig,
        CancellationToken token
) {

    public ConvergenceRequest {
        Objects.requireNonNull(buildConfig, "buildConfig");
        Objects.requireNonNull(deployConfig, "deployConfig");
        token = token != null ? token : new CancellationToken();
    }

    public boolean hasExplicitRevision() {
        return explicitRevision != null && !explicitRevision.isBlank();
    }
}
