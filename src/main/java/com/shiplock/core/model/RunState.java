package com.shiplock.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one convergence run.
 * <p>
 * {@code CONVERGED} is the only successful terminal state. Every other terminal
 * state carries its own process exit code.
 */
public enum RunState {
    INIT(-1),
    PUBLISHING(-1),
    BUILDING(-1),
    BUILD_OK(-1),
    DEPLOYING(-1),
    CONVERGED(0),

    RESOLUTION_FAILED(10),
    PUBLISH_FAILED(11),
    SUBMISSION_FAILED(20),
    BUILD_FAILED(21),
    BUILD_TIMEOUT(22),
    DEPLOY_REQUEST_FAILED(30),
    DEPLOY_TIMEOUT(31),
    ABORTED(130);

    private final int exitCode;

    RunState(int exitCode) {
        this.exitCode = exitCode;
    }

    public boolean isTerminal() {
        return exitCode >= 0;
    }

    public boolean isSuccess() {
        return this == CONVERGED;
    }

    /**
     * Process exit code for a terminal state.
     *
     * @throws IllegalStateException if the state is still in progress
     */
    public int exitCode() {
        if (!isTerminal()) {
            throw new IllegalStateException("No exit code for in-progress state " + this);
        }
        return exitCode;
    }

    /** States reachable in one step from this one. Terminal states have none. */
    public Set<RunState> successors() {
        return switch (this) {
            case INIT -> EnumSet.of(PUBLISHING, RESOLUTION_FAILED, ABORTED);
            case PUBLISHING -> EnumSet.of(BUILDING, PUBLISH_FAILED, ABORTED);
            case BUILDING -> EnumSet.of(BUILD_OK, SUBMISSION_FAILED, BUILD_FAILED, BUILD_TIMEOUT, ABORTED);
            case BUILD_OK -> EnumSet.of(DEPLOYING, ABORTED);
            case DEPLOYING -> EnumSet.of(CONVERGED, DEPLOY_REQUEST_FAILED, DEPLOY_TIMEOUT, ABORTED);
            default -> EnumSet.noneOf(RunState.class);
        };
    }

    public boolean canTransitionTo(RunState next) {
        return successors().contains(next);
    }
}
