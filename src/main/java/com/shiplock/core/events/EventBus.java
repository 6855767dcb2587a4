package com.shiplock.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Routes the progress events of a convergence run to the one listener watching it.
 * <p>
 * A run has at most one listener, normally the console of the {@code converge}
 * command. Events of a run nobody watches are dropped. A listener that throws is
 * detached on the spot and the run carries on without it.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, Consumer<ShiplockEvent>> listeners = new ConcurrentHashMap<>();

    /**
     * Attaches the listener for {@code runId}. Close the returned handle once the run is over.
     *
     * @throws IllegalStateException if the run already has a listener
     */
    public Attachment attach(String runId, Consumer<ShiplockEvent> listener) {
        if (listeners.putIfAbsent(runId, listener) != null) {
            throw new IllegalStateException("Run " + runId + " already has a listener");
        }
        return () -> listeners.remove(runId, listener);
    }

    public void publish(ShiplockEvent event) {
        var listener = listeners.get(event.runId());
        if (listener == null) {
            log.trace("No listener for run {}, dropping {}", event.runId(), event.eventType());
            return;
        }
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            listeners.remove(event.runId(), listener);
            log.warn("Listener for run {} failed on {}, detached: {}",
                    event.runId(), event.eventType(), e.getMessage(), e);
        }
    }

    /** Handle returned by {@link #attach}; closing it detaches the listener. */
    @FunctionalInterface
    public interface Attachment extends AutoCloseable {
        @Override
        void close();
    }
}
