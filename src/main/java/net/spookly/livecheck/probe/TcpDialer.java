package net.spookly.livecheck.probe;

import java.net.InetSocketAddress;

/**
 * Makes a single TCP connection attempt against a probe target.
 */
public interface TcpDialer extends AutoCloseable {
    /**
     * Attempt one connection, closing it again on success. The attempt ends early when {@code scope} is cancelled.
     *
     * @return true when a connection was established.
     */
    boolean dial(InetSocketAddress address, ProbeScope scope);

    @Override
    default void close() {
    }
}
