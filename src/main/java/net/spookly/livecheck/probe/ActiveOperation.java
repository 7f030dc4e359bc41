package net.spookly.livecheck.probe;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registration of one running operation. Closing it ends the scope and releases the request id.
 */
public final class ActiveOperation implements AutoCloseable {
    private final CancellationRegistry registry;
    private final long requestId;
    private final ProbeScope scope;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    ActiveOperation(CancellationRegistry registry, long requestId, ProbeScope scope) {
        this.registry = registry;
        this.requestId = requestId;
        this.scope = scope;
    }

    public long requestId() {
        return requestId;
    }

    public ProbeScope scope() {
        return scope;
    }

    /**
     * Safe to call more than once and concurrently with {@link CancellationRegistry#cancel(long)}.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            registry.complete(requestId, scope);
        }
    }
}
