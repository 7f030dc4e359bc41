package net.spookly.livecheck.probe;

import java.time.Instant;

import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Snapshot of a probe lifecycle change for audit logging.
 */
@Value
@Accessors(fluent = true)
public class ProbeEvent {
    ProbeEventType type;
    Instant timestamp;
    long requestId;
    String address;
    String detail;
}
