package net.spookly.livecheck.probe;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import lombok.extern.slf4j.Slf4j;
import net.spookly.livecheck.config.ConfigDefaults;
import net.spookly.livecheck.config.LivecheckConfig;

/**
 * Entry point for callers that start probes by request id and cancel them from another thread.
 */
@Slf4j
public final class ProbeDispatcher implements AutoCloseable {
    private final CancellationRegistry registry;
    private final LivenessProber prober;
    private final ProbeEventListener eventListener;
    private final ExecutorService workers;
    private final Clock clock;
    private final ProbeScope baseScope = ProbeScope.root();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Create a dispatcher running asynchronous probes on an unbounded worker pool.
     */
    public ProbeDispatcher(LivenessProber prober, ProbeEventListener eventListener) {
        this(new CancellationRegistry(), prober, eventListener, Executors.newCachedThreadPool(threadFactory()), Clock.systemUTC());
    }

    public ProbeDispatcher(CancellationRegistry registry,
                           LivenessProber prober,
                           ProbeEventListener eventListener,
                           ExecutorService workers,
                           Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.prober = Objects.requireNonNull(prober, "prober");
        this.eventListener = eventListener == null ? ProbeEventListener.NOOP : eventListener;
        this.workers = Objects.requireNonNull(workers, "workers");
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Build a dispatcher with a Netty dialer and the probe settings from config.
     */
    public static ProbeDispatcher fromConfig(LivecheckConfig config, ProbeEventListener eventListener) {
        int intervalMs = ConfigDefaults.DEFAULT_INTERVAL_MS;
        int logIntervalMs = ConfigDefaults.DEFAULT_LOG_INTERVAL_MS;
        Integer connectTimeoutMs = null;
        Integer workerThreads = null;
        LivecheckConfig.ProbeConfig probe = config == null ? null : config.probe;
        if (probe != null) {
            if (probe.intervalMs != null) {
                intervalMs = probe.intervalMs;
            }
            if (probe.logIntervalMs != null) {
                logIntervalMs = probe.logIntervalMs;
            }
            connectTimeoutMs = probe.connectTimeoutMs;
            workerThreads = probe.workerThreads;
        }
        LivenessProber prober = new LivenessProber(
                new NettyTcpDialer(connectTimeoutMs),
                Duration.ofMillis(intervalMs),
                Duration.ofMillis(logIntervalMs),
                Clock.systemUTC()
        );
        ExecutorService workers = workerThreads == null
                ? Executors.newCachedThreadPool(threadFactory())
                : Executors.newFixedThreadPool(workerThreads, threadFactory());
        return new ProbeDispatcher(new CancellationRegistry(), prober, eventListener, workers, Clock.systemUTC());
    }

    /**
     * Scope every probe started without an explicit scope derives from. Cancelled on {@link #close()}.
     */
    public ProbeScope baseScope() {
        return baseScope;
    }

    public CancellationRegistry registry() {
        return registry;
    }

    /**
     * Probe {@code address} under {@code id} on the calling thread until it is live, cancelled or rejected.
     *
     * @throws DuplicateRequestIdException when {@code id} is still in use.
     */
    public void startProbe(long id, String address) throws ProbeException {
        startProbe(baseScope, id, address);
    }

    /**
     * Same as {@link #startProbe(long, String)} with a caller-supplied scope, for example one with a deadline.
     */
    public void startProbe(ProbeScope scope, long id, String address) throws ProbeException {
        run(registry.begin(scope, id), address);
    }

    /**
     * Register {@code id} immediately and run the probe on the worker pool.
     * A {@link #cancel(long)} issued after this method returns always reaches the probe.
     */
    public CompletableFuture<Void> startProbeAsync(long id, String address) {
        return startProbeAsync(baseScope, id, address);
    }

    public CompletableFuture<Void> startProbeAsync(ProbeScope scope, long id, String address) {
        ActiveOperation operation = registry.begin(scope, id);
        QueuedProbe task = new QueuedProbe(operation, address);
        try {
            workers.execute(task);
        } catch (RejectedExecutionException e) {
            operation.close();
            throw e;
        }
        return task.result;
    }

    /**
     * Cancel the probe running under {@code id}, if any.
     */
    public void cancel(long id) {
        registry.cancel(id);
    }

    /**
     * Cancel every running probe and release worker and dialer resources.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        baseScope.cancel();
        List<Runnable> neverStarted = workers.shutdownNow();
        for (Runnable task : neverStarted) {
            if (task instanceof QueuedProbe) {
                ((QueuedProbe) task).abandon();
            }
        }
        prober.close();
    }

    private void run(ActiveOperation operation, String address) throws ProbeException {
        long id = operation.requestId();
        try (operation) {
            emit(ProbeEventType.STARTED, id, address, null);
            prober.probe(operation.scope(), address);
        } catch (MalformedAddressException e) {
            emit(ProbeEventType.REJECTED, id, address, e.getMessage());
            throw e;
        } catch (ProbeCancelledException e) {
            emit(ProbeEventType.CANCELLED, id, address, null);
            throw e;
        }
        emit(ProbeEventType.SUCCEEDED, id, address, null);
    }

    private void emit(ProbeEventType type, long id, String address, String detail) {
        try {
            eventListener.onEvent(new ProbeEvent(type, clock.instant(), id, address, detail));
        } catch (RuntimeException e) {
            log.warn("Failed to emit probe event: {}", e.getMessage());
        }
    }

    /**
     * Probe waiting for a worker. Tasks dropped by {@link #close()} release their id here.
     */
    private final class QueuedProbe implements Runnable {
        private final ActiveOperation operation;
        private final String address;
        private final CompletableFuture<Void> result = new CompletableFuture<>();

        private QueuedProbe(ActiveOperation operation, String address) {
            this.operation = operation;
            this.address = address;
        }

        @Override
        public void run() {
            try {
                ProbeDispatcher.this.run(operation, address);
                result.complete(null);
            } catch (ProbeException | RuntimeException e) {
                result.completeExceptionally(e);
            }
        }

        private void abandon() {
            operation.close();
            emit(ProbeEventType.CANCELLED, operation.requestId(), address, null);
            result.completeExceptionally(new ProbeCancelledException(address));
        }
    }

    private static ThreadFactory threadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "livecheck-probe-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
