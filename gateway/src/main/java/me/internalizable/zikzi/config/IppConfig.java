package me.internalizable.zikzi.config;

import java.util.ArrayList;
import java.util.List;

/**
 * IPP-over-HTTP listener settings.
 */
public class IppConfig {

    private boolean enabled = true;
    private String host = "0.0.0.0";
    private int port = 631;

    // Hostname advertised in printer-uri-supported and job-uri; defaults to the bind host
    private String externalHostname = null;

    // Forwarded-for headers are honoured only from trusted peers
    private boolean trustProxy = false;
    private List<String> trustedProxies = new ArrayList<>();

    private int maxRequestBytes = 256 * 1024 * 1024;

    private IppAuthConfig auth = new IppAuthConfig();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }

    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }

    public String getExternalHostname() { return externalHostname; }
    public void setExternalHostname(String externalHostname) { this.externalHostname = externalHostname; }

    public boolean isTrustProxy() { return trustProxy; }
    public void setTrustProxy(boolean trustProxy) { this.trustProxy = trustProxy; }

    public List<String> getTrustedProxies() { return trustedProxies; }
    public void setTrustedProxies(List<String> trustedProxies) {
        this.trustedProxies = trustedProxies != null ? new ArrayList<>(trustedProxies) : new ArrayList<>();
    }

    public int getMaxRequestBytes() { return maxRequestBytes; }
    public void setMaxRequestBytes(int maxRequestBytes) { this.maxRequestBytes = maxRequestBytes; }

    public IppAuthConfig getAuth() { return auth; }
    public void setAuth(IppAuthConfig auth) { this.auth = auth != null ? auth : new IppAuthConfig(); }

    /**
     * Builds the URI clients use to reach the printer, e.g. {@code ipp://localhost:631/ipp/print}.
     */
    public String getPrinterUri() {
        String hostname = externalHostname;
        if (hostname == null || hostname.isEmpty()) {
            hostname = host;
        }
        if (hostname == null || hostname.isEmpty() || "0.0.0.0".equals(hostname)) {
            hostname = "localhost";
        }
        return "ipp://" + hostname + ":" + port + "/ipp/print";
    }
}
