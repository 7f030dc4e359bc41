package net.spookly.livecheck.probe;

/**
 * Lifecycle events emitted by the probe dispatcher.
 */
public enum ProbeEventType {
    /** Request id registered and probe starting. */
    STARTED,
    /** Target accepted a connection. */
    SUCCEEDED,
    /** Probe scope ended before the target became live. */
    CANCELLED,
    /** Address rejected before any connection attempt. */
    REJECTED
}
