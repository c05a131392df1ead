package me.internalizable.zikzi.raw;

import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.util.concurrent.EventExecutorGroup;
import me.internalizable.zikzi.config.PrinterConfig;
import me.internalizable.zikzi.config.ProxyProtocolConfig;
import me.internalizable.zikzi.net.TrustedProxyMatcher;
import me.internalizable.zikzi.pipeline.proxy.ProxyProtocolHandler;
import me.internalizable.zikzi.pipeline.proxy.ProxyProtocolPolicy;
import me.internalizable.zikzi.server.NettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Raw PostScript listener (JetDirect style, port 9100 by default).
 *
 * <p>A connection carries exactly one document and ends when the client closes it.
 * When PROXY protocol support is enabled, a {@link ProxyProtocolHandler} is placed in front
 * of the {@link RawJobHandler} according to the {@link ProxyProtocolPolicy} of the peer.</p>
 */
public class RawSocketServer extends NettyServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(RawSocketServer.class);

    private final ProxyProtocolConfig proxyProtocol;
    private final TrustedProxyMatcher proxyMatcher;
    private final RawIntake intake;
    private final boolean debugMode;

    public RawSocketServer(@Nonnull PrinterConfig config, @Nonnull RawIntake intake, boolean debugMode) {
        super("PostScript printer server", config.getHost(), config.getPort());
        this.proxyProtocol = Objects.requireNonNull(config.getProxyProtocol(), "proxyProtocol");
        this.proxyMatcher = new TrustedProxyMatcher(proxyProtocol.getTrustedProxies(), false);
        this.intake = Objects.requireNonNull(intake, "intake");
        this.debugMode = debugMode;

        if (proxyProtocol.isEnabled()) {
            LOGGER.info("PROXY protocol enabled ({})",
                proxyMatcher.hasEntries() ? "trusted proxies only" : "required on every connection");
        }
    }

    @Override
    protected void initConnection(@Nonnull SocketChannel ch, @Nonnull EventExecutorGroup blockingGroup) {
        InetSocketAddress peer = ch.remoteAddress();
        ProxyProtocolPolicy policy = ProxyProtocolPolicy.select(proxyProtocol, proxyMatcher, peer.getAddress());
        if (debugMode) {
            LOGGER.debug("Raw connection from {} (PROXY policy {})", peer, policy);
        }

        ChannelPipeline pipeline = ch.pipeline();
        boolean awaitProxyHeader = policy != ProxyProtocolPolicy.IGNORE;
        if (awaitProxyHeader) {
            long timeoutMillis = TimeUnit.SECONDS.toMillis(proxyProtocol.getHeaderTimeoutSeconds());
            pipeline.addLast("proxy-protocol", new ProxyProtocolHandler(policy, timeoutMillis, debugMode));
        }
        pipeline.addLast(blockingGroup, "raw-job", new RawJobHandler(intake, awaitProxyHeader));
    }
}
