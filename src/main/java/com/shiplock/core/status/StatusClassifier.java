package com.shiplock.core.status;

import com.shiplock.core.model.BuildHandle;
import com.shiplock.core.model.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps raw build status tokens onto the closed {@link Outcome} set.
 *
 * <p>{@link #classify(String)} is a pure function. An instance additionally
 * remembers the first terminal outcome seen per build, so a build that flips
 * from terminal to anything else is reported as a
 * {@link StatusContractViolationException}. Create one instance per run.
 */
public class StatusClassifier {

    private static final Logger log = LoggerFactory.getLogger(StatusClassifier.class);

    private static final Map<String, Outcome> KNOWN_TOKENS = Map.ofEntries(
            Map.entry("SUCCESS", Outcome.SUCCEEDED),
            Map.entry("SUCCEEDED", Outcome.SUCCEEDED),
            Map.entry("COMPLETED", Outcome.SUCCEEDED),
            Map.entry("FAILED", Outcome.FAILED),
            Map.entry("FAILURE", Outcome.FAILED),
            Map.entry("ERROR", Outcome.FAILED),
            Map.entry("CANCELLED", Outcome.CANCELLED),
            Map.entry("CANCELED", Outcome.CANCELLED),
            Map.entry("ABORTED", Outcome.CANCELLED),
            Map.entry("PENDING", Outcome.PENDING),
            Map.entry("QUEUED", Outcome.PENDING),
            Map.entry("WAITING", Outcome.PENDING),
            Map.entry("RUNNING", Outcome.RUNNING),
            Map.entry("BUILDING", Outcome.RUNNING),
            Map.entry("STARTING", Outcome.RUNNING),
            Map.entry("IN_PROGRESS", Outcome.RUNNING)
    );

    private final Map<BuildHandle, Outcome> terminalByHandle = new HashMap<>();
    private final Set<String> reportedUnknown = new HashSet<>();

    /**
     * Classifies a raw status token.
     *
     * @param rawStatus token as reported; {@code null} or blank means the build is not listed yet
     */
    public static Outcome classify(String rawStatus) {
        if (rawStatus == null || rawStatus.isBlank()) {
            return Outcome.PENDING;
        }
        return KNOWN_TOKENS.getOrDefault(rawStatus.trim().toUpperCase(Locale.ROOT), Outcome.UNKNOWN);
    }

    /**
     * Classifies an observation for a specific build and enforces that terminal
     * outcomes never change.
     *
     * @throws StatusContractViolationException if the build was already terminal with a different outcome
     */
    public Outcome observe(BuildHandle handle, String rawStatus) {
        var outcome = classify(rawStatus);

        var previous = terminalByHandle.get(handle);
        if (previous != null && previous != outcome) {
            throw new StatusContractViolationException(handle, previous, rawStatus);
        }
        if (outcome.isTerminal()) {
            terminalByHandle.put(handle, outcome);
        }
        if (outcome == Outcome.UNKNOWN && reportedUnknown.add(rawStatus.trim())) {
            log.warn("Unrecognised build status '{}' for build {}, treating as in progress", rawStatus, handle);
        }
        return outcome;
    }
}
