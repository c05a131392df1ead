package me.internalizable.zikzi.net;

import com.google.common.collect.ImmutableList;
import com.google.common.net.InetAddresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.InetAddress;
import java.util.Collection;
import java.util.List;

/**
 * Decides whether a peer may supply forwarded client addresses, either through HTTP
 * headers or through a PROXY protocol preamble.
 *
 * <p>Entries are bare addresses ({@code 192.168.1.1}, {@code ::1}) or CIDR ranges
 * ({@code 10.0.0.0/8}). Bare addresses match exactly, as a /32 or /128 network.
 * Entries that do not parse are logged and ignored.</p>
 *
 * <p>With no entries configured, {@link #isTrusted(String)} answers with the global
 * trust toggle.</p>
 */
public final class TrustedProxyMatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(TrustedProxyMatcher.class);

    private final List<Network> networks;
    private final boolean trustAllWhenEmpty;

    /**
     * @param entries           configured addresses and CIDR ranges
     * @param trustAllWhenEmpty the answer when no entry is configured
     */
    public TrustedProxyMatcher(@Nonnull Collection<String> entries, boolean trustAllWhenEmpty) {
        ImmutableList.Builder<Network> builder = ImmutableList.builder();
        for (String entry : entries) {
            Network network = Network.parse(entry);
            if (network == null) {
                LOGGER.warn("Ignoring invalid trusted proxy entry: {}", entry);
                continue;
            }
            builder.add(network);
        }
        this.networks = builder.build();
        this.trustAllWhenEmpty = trustAllWhenEmpty;
    }

    /**
     * Whether any network is configured.
     */
    public boolean hasEntries() {
        return !networks.isEmpty();
    }

    public boolean isTrusted(@Nullable String ip) {
        if (networks.isEmpty()) {
            return trustAllWhenEmpty;
        }
        if (ip == null || !InetAddresses.isInetAddress(ip)) {
            return false;
        }
        return isTrusted(InetAddresses.forString(ip));
    }

    public boolean isTrusted(@Nonnull InetAddress address) {
        if (networks.isEmpty()) {
            return trustAllWhenEmpty;
        }
        byte[] candidate = address.getAddress();
        for (Network network : networks) {
            if (network.contains(candidate)) {
                return true;
            }
        }
        return false;
    }

    // ==================== Networks ====================

    private static final class Network {

        private final byte[] base;
        private final int prefixLength;

        private Network(byte[] base, int prefixLength) {
            this.base = base;
            this.prefixLength = prefixLength;
        }

        @Nullable
        static Network parse(@Nullable String entry) {
            if (entry == null) {
                return null;
            }
            String trimmed = entry.trim();
            int slash = trimmed.indexOf('/');
            String host = slash >= 0 ? trimmed.substring(0, slash) : trimmed;
            if (!InetAddresses.isInetAddress(host)) {
                return null;
            }
            byte[] base = InetAddresses.forString(host).getAddress();
            int maxPrefix = base.length * 8;
            int prefix = maxPrefix;
            if (slash >= 0) {
                try {
                    prefix = Integer.parseInt(trimmed.substring(slash + 1));
                } catch (NumberFormatException e) {
                    return null;
                }
                if (prefix < 0 || prefix > maxPrefix) {
                    return null;
                }
            }
            return new Network(base, prefix);
        }

        boolean contains(byte[] candidate) {
            // An IPv4 entry never matches an IPv6 address and vice versa
            if (candidate.length != base.length) {
                return false;
            }
            int fullBytes = prefixLength / 8;
            for (int i = 0; i < fullBytes; i++) {
                if (candidate[i] != base[i]) {
                    return false;
                }
            }
            int remainingBits = prefixLength % 8;
            if (remainingBits == 0) {
                return true;
            }
            int mask = (0xFF << (8 - remainingBits)) & 0xFF;
            return (candidate[fullBytes] & mask) == (base[fullBytes] & mask);
        }
    }
}
