package net.spookly.livecheck.probe;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

import lombok.extern.slf4j.Slf4j;
import net.spookly.livecheck.util.ProbeAddress;

/**
 * Waits for a TCP endpoint to accept connections, polling at a fixed interval until it does or the scope ends.
 */
@Slf4j
public final class LivenessProber implements AutoCloseable {
    public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(100);
    public static final Duration DEFAULT_LOG_INTERVAL = Duration.ofSeconds(1);

    private final TcpDialer dialer;
    private final Duration interval;
    private final Duration logInterval;
    private final Clock clock;

    public LivenessProber(TcpDialer dialer) {
        this(dialer, DEFAULT_INTERVAL, DEFAULT_LOG_INTERVAL, Clock.systemUTC());
    }

    public LivenessProber(TcpDialer dialer, Duration interval, Duration logInterval, Clock clock) {
        this.dialer = Objects.requireNonNull(dialer, "dialer");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.logInterval = Objects.requireNonNull(logInterval, "logInterval");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
    }

    /**
     * Block until {@code address} accepts a TCP connection.
     *
     * @throws MalformedAddressException when the address is not a literal {@code ip:port}; nothing is dialed.
     * @throws ProbeCancelledException when {@code scope} ends first.
     */
    public void probe(ProbeScope scope, String address) throws MalformedAddressException, ProbeCancelledException {
        Objects.requireNonNull(scope, "scope");
        InetSocketAddress target = ProbeAddress.parse(address).toSocketAddress();

        long intervalNanos = interval.toNanos();
        long nextTick = System.nanoTime() + intervalNanos;
        long lastLogMillis = Long.MIN_VALUE;
        while (true) {
            Duration untilTick = Duration.ofNanos(nextTick - System.nanoTime());
            if (scope.awaitCancellation(untilTick)) {
                throw new ProbeCancelledException(address);
            }
            long nowMillis = clock.millis();
            if (lastLogMillis == Long.MIN_VALUE || nowMillis - lastLogMillis >= logInterval.toMillis()) {
                log.info("Checking address {}", address);
                lastLogMillis = nowMillis;
            }
            if (dialer.dial(target, scope)) {
                return;
            }
            if (scope.isCancelled()) {
                throw new ProbeCancelledException(address);
            }
            // Ticks missed during a slow dial collapse into one, like a dropping ticker.
            nextTick = Math.max(nextTick + intervalNanos, System.nanoTime());
        }
    }

    @Override
    public void close() {
        dialer.close();
    }
}
