package me.internalizable.zikzi.pipeline.proxy;

import javax.annotation.Nullable;
import java.net.InetSocketAddress;

/**
 * User event fired by {@link ProxyProtocolHandler} once the connection preamble has been
 * dealt with, before any payload byte is passed on.
 */
public final class ProxyProtocolEvent {

    private final InetSocketAddress sourceAddress;

    public ProxyProtocolEvent(@Nullable InetSocketAddress sourceAddress) {
        this.sourceAddress = sourceAddress;
    }

    /**
     * The client address announced by the proxy, or null when the connection carried no
     * usable header and the peer address applies.
     */
    @Nullable
    public InetSocketAddress getSourceAddress() {
        return sourceAddress;
    }

    @Override
    public String toString() {
        return "ProxyProtocolEvent{source=" + (sourceAddress != null ? sourceAddress : "peer") + '}';
    }
}
