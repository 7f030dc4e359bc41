package net.spookly.livecheck.probe;

/**
 * Listener for probe lifecycle events.
 */
@FunctionalInterface
public interface ProbeEventListener {
    ProbeEventListener NOOP = event -> {
    };

    void onEvent(ProbeEvent event);
}
