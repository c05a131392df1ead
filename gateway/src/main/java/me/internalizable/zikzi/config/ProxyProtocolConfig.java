package me.internalizable.zikzi.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for HAProxy PROXY protocol support on the raw PostScript listener.
 *
 * <p>The PROXY protocol lets a TCP load balancer pass the original client address to
 * the gateway. Since attribution of raw jobs is based on that address, the header is
 * only honoured from trusted peers.</p>
 *
 * <h2>Policy</h2>
 * <ul>
 *   <li>disabled: headers are never parsed</li>
 *   <li>enabled, no trusted proxies: every connection MUST start with a valid header</li>
 *   <li>enabled, peer listed: the header is parsed when present</li>
 *   <li>enabled, peer not listed: the connection is passed through untouched</li>
 * </ul>
 *
 * @see <a href="https://www.haproxy.org/download/2.0/doc/proxy-protocol.txt">PROXY Protocol Specification</a>
 */
public class ProxyProtocolConfig {

    /**
     * Whether to enable PROXY protocol support.
     */
    private boolean enabled = false;

    /**
     * Trusted proxy addresses or CIDR ranges (e.g. "10.0.0.0/8").
     * If empty while enabled, the header is required from every peer.
     */
    private List<String> trustedProxies = new ArrayList<>();

    /**
     * Seconds to wait for a complete PROXY header before closing the connection.
     */
    private int headerTimeoutSeconds = 10;

    // ==================== Constructors ====================

    public ProxyProtocolConfig() {
    }

    public ProxyProtocolConfig(boolean enabled, List<String> trustedProxies) {
        this.enabled = enabled;
        this.trustedProxies = trustedProxies != null ? new ArrayList<>(trustedProxies) : new ArrayList<>();
    }

    // ==================== Getters/Setters ====================

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getTrustedProxies() {
        return trustedProxies;
    }

    public void setTrustedProxies(List<String> trustedProxies) {
        this.trustedProxies = trustedProxies != null ? new ArrayList<>(trustedProxies) : new ArrayList<>();
    }

    public int getHeaderTimeoutSeconds() {
        return headerTimeoutSeconds;
    }

    public void setHeaderTimeoutSeconds(int headerTimeoutSeconds) {
        this.headerTimeoutSeconds = headerTimeoutSeconds;
    }

    @Override
    public String toString() {
        return "ProxyProtocolConfig{" +
                "enabled=" + enabled +
                ", trustedProxies=" + trustedProxies +
                ", headerTimeoutSeconds=" + headerTimeoutSeconds +
                '}';
    }
}
