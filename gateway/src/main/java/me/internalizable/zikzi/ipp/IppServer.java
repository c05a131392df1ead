package me.internalizable.zikzi.ipp;

import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.EventExecutorGroup;
import me.internalizable.zikzi.config.IppConfig;
import me.internalizable.zikzi.net.TrustedProxyMatcher;
import me.internalizable.zikzi.server.NettyServer;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * IPP-over-HTTP listener (port 631 by default).
 */
public class IppServer extends NettyServer {

    private final IppService service;
    private final TrustedProxyMatcher proxyMatcher;
    private final int maxRequestBytes;

    public IppServer(@Nonnull IppConfig config, @Nonnull IppService service) {
        super("IPP server", config.getHost(), config.getPort());
        this.service = Objects.requireNonNull(service, "service");
        this.proxyMatcher = new TrustedProxyMatcher(config.getTrustedProxies(), config.isTrustProxy());
        this.maxRequestBytes = config.getMaxRequestBytes();
    }

    @Override
    protected void initConnection(@Nonnull SocketChannel ch, @Nonnull EventExecutorGroup blockingGroup) {
        ChannelPipeline pipeline = ch.pipeline();
        pipeline.addLast("http-codec", new HttpServerCodec());
        pipeline.addLast("http-aggregator", new HttpObjectAggregator(maxRequestBytes));
        pipeline.addLast(blockingGroup, "ipp", new IppHttpHandler(service, proxyMatcher));
    }
}
