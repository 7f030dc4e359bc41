package net.spookly.livecheck.probe;

import java.net.InetSocketAddress;
import java.util.Objects;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.extern.slf4j.Slf4j;

/**
 * Netty-backed TCP dialer. Connections are closed as soon as they are established.
 */
@Slf4j
public final class NettyTcpDialer implements TcpDialer {
    private final EventLoopGroup workerGroup;
    private final boolean ownsWorkerGroup;
    private final Integer connectTimeoutMs;

    /**
     * Create a dialer with a dedicated event loop.
     *
     * @param connectTimeoutMs optional cap on a single attempt, or null for Netty's default.
     */
    public NettyTcpDialer(Integer connectTimeoutMs) {
        this(new NioEventLoopGroup(1, new DefaultThreadFactory("livecheck-dial", true)), true, connectTimeoutMs);
    }

    /**
     * Create a dialer sharing an existing event loop group.
     */
    public NettyTcpDialer(EventLoopGroup workerGroup, Integer connectTimeoutMs) {
        this(workerGroup, false, connectTimeoutMs);
    }

    private NettyTcpDialer(EventLoopGroup workerGroup, boolean ownsWorkerGroup, Integer connectTimeoutMs) {
        this.workerGroup = Objects.requireNonNull(workerGroup, "workerGroup");
        this.ownsWorkerGroup = ownsWorkerGroup;
        this.connectTimeoutMs = connectTimeoutMs;
    }

    @Override
    public boolean dial(InetSocketAddress address, ProbeScope scope) {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(scope, "scope");
        if (scope.isCancelled()) {
            return false;
        }
        Bootstrap bootstrap = new Bootstrap();
        bootstrap.group(workerGroup)
                .channel(NioSocketChannel.class)
                .handler(new ProbeChannelHandler());
        if (connectTimeoutMs != null && connectTimeoutMs > 0) {
            bootstrap.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMs);
        }

        ChannelFuture connectFuture = bootstrap.connect(address);
        // A connect in progress cannot be cancelled through the future, closing the channel fails it instead.
        ProbeScope.Registration registration = scope.onCancel(() -> {
            if (!connectFuture.cancel(false)) {
                connectFuture.channel().close();
            }
        });
        try {
            connectFuture.awaitUninterruptibly();
        } finally {
            registration.remove();
        }
        if (!connectFuture.isSuccess()) {
            if (log.isTraceEnabled()) {
                log.trace("Connect to {} failed: {}", address, describe(connectFuture));
            }
            return false;
        }
        connectFuture.channel().close();
        return true;
    }

    @Override
    public void close() {
        if (!ownsWorkerGroup) {
            return;
        }
        workerGroup.shutdownGracefully();
    }

    private static String describe(ChannelFuture future) {
        if (future.isCancelled()) {
            return "cancelled";
        }
        Throwable cause = future.cause();
        return cause == null ? "unknown" : cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    private static final class ProbeChannelHandler extends ChannelInboundHandlerAdapter {
    }
}
