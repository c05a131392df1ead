package me.internalizable.zikzi.config;

/**
 * Authentication methods offered on the IPP endpoint.
 */
public class IppAuthConfig {

    // Attribute requests from registered addresses without credentials
    private boolean allowIp = true;

    // HTTP Basic and Digest with account passwords or tokens
    private boolean allowLogin = true;

    private String realm = "zikzi";

    public boolean isAllowIp() { return allowIp; }
    public void setAllowIp(boolean allowIp) { this.allowIp = allowIp; }

    public boolean isAllowLogin() { return allowLogin; }
    public void setAllowLogin(boolean allowLogin) { this.allowLogin = allowLogin; }

    public String getRealm() { return realm; }
    public void setRealm(String realm) { this.realm = realm; }
}
