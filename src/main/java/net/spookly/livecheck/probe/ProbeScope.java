package net.spookly.livecheck.probe;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import lombok.extern.slf4j.Slf4j;

/**
 * Cancellable lifetime of a probe operation.
 * <p>
 * A child scope is cancelled together with its parent, but cancelling a child never affects the parent.
 * Cancellation is idempotent and listeners run exactly once, outside any internal lock.
 */
@Slf4j
public final class ProbeScope {
    private static final ScheduledThreadPoolExecutor DEADLINES = deadlineScheduler();

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<Runnable> listeners = new ArrayList<>();
    private boolean done;

    private ProbeScope() {
    }

    /**
     * Create a scope with no parent. It ends only through {@link #cancel()}.
     */
    public static ProbeScope root() {
        return new ProbeScope();
    }

    /**
     * Derive a scope that ends when this scope ends or when it is cancelled itself.
     */
    public ProbeScope child() {
        ProbeScope child = new ProbeScope();
        Registration link = onCancel(child::cancel);
        child.onCancel(link::remove);
        return child;
    }

    /**
     * Derive a child scope that is cancelled automatically once {@code timeout} has elapsed.
     */
    public ProbeScope withTimeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        ProbeScope child = child();
        if (child.isCancelled()) {
            return child;
        }
        ScheduledFuture<?> deadline = DEADLINES.schedule(child::cancel, timeout.toNanos(), TimeUnit.NANOSECONDS);
        child.onCancel(() -> deadline.cancel(false));
        return child;
    }

    /**
     * End this scope and every scope derived from it.
     */
    public void cancel() {
        List<Runnable> toRun;
        synchronized (listeners) {
            if (done) {
                return;
            }
            done = true;
            toRun = new ArrayList<>(listeners);
            listeners.clear();
        }
        cancelled.countDown();
        for (Runnable listener : toRun) {
            runListener(listener);
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Run {@code listener} when this scope is cancelled, or right away if it already is.
     */
    public Registration onCancel(Runnable listener) {
        Objects.requireNonNull(listener, "listener");
        synchronized (listeners) {
            if (!done) {
                listeners.add(listener);
                return () -> {
                    synchronized (listeners) {
                        listeners.remove(listener);
                    }
                };
            }
        }
        runListener(listener);
        return Registration.NOOP;
    }

    /**
     * Block until this scope is cancelled or {@code timeout} elapses.
     * An interrupt of the waiting thread cancels the scope.
     *
     * @return true when the scope is cancelled.
     */
    public boolean awaitCancellation(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        try {
            return cancelled.await(Math.max(0L, timeout.toNanos()), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            return true;
        }
    }

    private static void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation listener failed: {}", e.getMessage(), e);
        }
    }

    static int pendingDeadlines() {
        return DEADLINES.getQueue().size();
    }

    private static ScheduledThreadPoolExecutor deadlineScheduler() {
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(1, threadFactory());
        // Scopes that end early must not leave their deadline queued until it expires.
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    private static ThreadFactory threadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "livecheck-scope-deadline");
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Handle for removing a cancellation listener that has not run yet.
     */
    @FunctionalInterface
    public interface Registration {
        Registration NOOP = () -> {
        };

        void remove();
    }
}
