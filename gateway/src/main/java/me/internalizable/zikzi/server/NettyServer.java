package me.internalizable.zikzi.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import io.netty.util.concurrent.GlobalEventExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Lifecycle shared by the gateway's TCP listeners.
 *
 * <p>Each listener has its own boss and worker event loops and a separate executor group
 * for handlers that block on files or the store. Open connections are tracked so that
 * {@link #stop(long)} can give them a grace period before closing them.</p>
 */
public abstract class NettyServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(NettyServer.class);

    private final String name;
    private final String host;
    private final int port;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup blockingGroup;
    private ChannelGroup connections;
    private Channel serverChannel;
    private volatile boolean running = false;

    protected NettyServer(@Nonnull String name, @Nonnull String host, int port) {
        this.name = Objects.requireNonNull(name, "name");
        this.host = Objects.requireNonNull(host, "host");
        this.port = port;
    }

    /**
     * Sets up the pipeline of an accepted connection.
     *
     * @param ch            the accepted connection
     * @param blockingGroup executor group for handlers doing blocking work
     */
    protected abstract void initConnection(@Nonnull SocketChannel ch, @Nonnull EventExecutorGroup blockingGroup);

    /**
     * Binds the listener.
     *
     * @throws InterruptedException if interrupted while binding
     */
    public void start() throws InterruptedException {
        if (running) {
            throw new IllegalStateException(name + " is already running");
        }

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        blockingGroup = new DefaultEventExecutorGroup(Math.max(4, Runtime.getRuntime().availableProcessors() * 2));
        connections = new DefaultChannelGroup(name, GlobalEventExecutor.INSTANCE);

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
            .channel(NioServerSocketChannel.class)
            .childOption(ChannelOption.SO_KEEPALIVE, true)
            .childHandler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    connections.add(ch);
                    initConnection(ch, blockingGroup);
                }
            });

        try {
            serverChannel = bootstrap.bind(new InetSocketAddress(host, port)).sync().channel();
        } catch (InterruptedException | RuntimeException e) {
            releaseResources();
            throw e;
        }

        running = true;
        LOGGER.info("{} listening on {}", name, serverChannel.localAddress());
    }

    /**
     * Stops accepting connections, waits up to the grace period for open ones to finish,
     * then closes the rest and releases the event loops.
     */
    public void stop(long graceSeconds) {
        if (!running) {
            return;
        }
        running = false;
        LOGGER.info("Stopping {}...", name);

        serverChannel.close().syncUninterruptibly();

        if (!connections.isEmpty()) {
            LOGGER.info("Waiting up to {} s for {} open connection(s)", graceSeconds, connections.size());
            if (!connections.newCloseFuture().awaitUninterruptibly(graceSeconds, TimeUnit.SECONDS)) {
                LOGGER.warn("Closing {} connection(s) still open after grace period", connections.size());
            }
        }
        connections.close().awaitUninterruptibly();

        releaseResources();
        LOGGER.info("{} stopped", name);
    }

    private void releaseResources() {
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }
        if (blockingGroup != null) {
            blockingGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }
    }

    /**
     * The bound address, or null before {@link #start()}.
     */
    public InetSocketAddress getLocalAddress() {
        return serverChannel != null ? (InetSocketAddress) serverChannel.localAddress() : null;
    }

    public boolean isRunning() {
        return running;
    }

    @Nonnull
    public String getName() {
        return name;
    }
}
