package me.internalizable.zikzi.config;

/**
 * Raw PostScript (port 9100 style) listener settings.
 */
public class PrinterConfig {

    private String host = "0.0.0.0";
    private int port = 9100;

    // Accept jobs from addresses without an IP registration (they become orphaned jobs)
    private boolean allowUnregisteredIps = false;

    private ProxyProtocolConfig proxyProtocol = new ProxyProtocolConfig();

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }

    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }

    public boolean isAllowUnregisteredIps() { return allowUnregisteredIps; }
    public void setAllowUnregisteredIps(boolean allowUnregisteredIps) { this.allowUnregisteredIps = allowUnregisteredIps; }

    public ProxyProtocolConfig getProxyProtocol() { return proxyProtocol; }
    public void setProxyProtocol(ProxyProtocolConfig proxyProtocol) {
        this.proxyProtocol = proxyProtocol != null ? proxyProtocol : new ProxyProtocolConfig();
    }
}
