package net.spookly.livecheck.probe;

import lombok.extern.slf4j.Slf4j;

/**
 * Default probe audit logger that emits one line per event.
 */
@Slf4j
public final class ProbeAuditLogger implements ProbeEventListener {
    public static final ProbeAuditLogger INSTANCE = new ProbeAuditLogger();

    private ProbeAuditLogger() {
    }

    @Override
    public void onEvent(ProbeEvent event) {
        log.info(format(event));
    }

    static String format(ProbeEvent event) {
        StringBuilder builder = new StringBuilder("probe_event");
        append(builder, "type", event.type());
        append(builder, "requestId", Long.toUnsignedString(event.requestId()));
        append(builder, "address", event.address());
        append(builder, "detail", event.detail());
        append(builder, "timestamp", event.timestamp());
        return builder.toString();
    }

    private static void append(StringBuilder builder, String key, Object value) {
        if (value == null) {
            return;
        }
        builder.append(' ').append(key).append('=').append(value);
    }
}
