package me.internalizable.zikzi.pipeline.proxy;

import me.internalizable.zikzi.config.ProxyProtocolConfig;
import me.internalizable.zikzi.net.TrustedProxyMatcher;

import javax.annotation.Nonnull;
import java.net.InetAddress;

/**
 * What to do with a possible PROXY protocol header on one connection.
 */
public enum ProxyProtocolPolicy {

    /** Parse the header when present, otherwise use the peer address. */
    USE,

    /** Never parse; the peer is not allowed to speak for another address. */
    IGNORE,

    /** Close the connection unless it starts with a valid header. */
    REQUIRE;

    /**
     * Selects the policy for a connection from its physical peer address.
     *
     * @param config  PROXY protocol settings of the listener
     * @param matcher trusted proxy list of the listener
     * @param peer    the address the TCP connection comes from
     */
    @Nonnull
    public static ProxyProtocolPolicy select(@Nonnull ProxyProtocolConfig config,
                                             @Nonnull TrustedProxyMatcher matcher,
                                             @Nonnull InetAddress peer) {
        if (!config.isEnabled()) {
            return IGNORE;
        }
        if (!matcher.hasEntries()) {
            return REQUIRE;
        }
        return matcher.isTrusted(peer) ? USE : IGNORE;
    }
}
