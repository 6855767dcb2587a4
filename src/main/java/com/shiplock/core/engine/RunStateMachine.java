package com.shiplock.core.engine;

import com.shiplock.core.model.RunState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Tracks the {@link RunState} of one run and rejects transitions the lifecycle does not allow.
 */
public class RunStateMachine {

    private static final Logger log = LoggerFactory.getLogger(RunStateMachine.class);

    private final String runId;
    private final List<RunState> history = new ArrayList<>();
    private RunState current = RunState.INIT;

    public RunStateMachine(String runId) {
        this.runId = runId;
        history.add(current);
    }

    public RunState current() {
        return current;
    }

    /** Every state visited so far, starting with {@code INIT}. */
    public List<RunState> history() {
        return List.copyOf(history);
    }

    /**
     * @throws IllegalStateException if {@code next} is not a successor of the current state
     */
    public void transition(RunState next) {
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException("Run %s cannot move from %s to %s".formatted(runId, current, next));
        }
        log.info("Run {} state {} -> {}", runId, current, next);
        current = next;
        history.add(next);
    }
}
