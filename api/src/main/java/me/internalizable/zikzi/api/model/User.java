package me.internalizable.zikzi.api.model;

import javax.annotation.Nullable;

/**
 * An account that print jobs can be attributed to.
 *
 * <p>Only the fields consulted by protocol authentication are modelled here; the
 * account lifecycle is owned by the management layer.</p>
 */
public class User {

    private String id;
    private String username;
    private String displayName;

    // bcrypt hash, empty when the account has no local password
    private String passwordHash;

    // Pre-computed MD5(username:realm:password) for HTTP Digest
    private String digestHa1;

    private boolean allowIppPassword = true;

    public User() {
    }

    public User(String id, String username) {
        this.id = id;
        this.username = username;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }

    @Nullable
    public String getPasswordHash() { return passwordHash; }
    public void setPasswordHash(String passwordHash) { this.passwordHash = passwordHash; }

    @Nullable
    public String getDigestHa1() { return digestHa1; }
    public void setDigestHa1(String digestHa1) { this.digestHa1 = digestHa1; }

    /**
     * Whether the account password may be used for Basic/Digest authentication on the
     * printing protocols. Tokens are accepted regardless.
     */
    public boolean isAllowIppPassword() { return allowIppPassword; }
    public void setAllowIppPassword(boolean allowIppPassword) { this.allowIppPassword = allowIppPassword; }

    public boolean hasPasswordHash() {
        return passwordHash != null && !passwordHash.isEmpty();
    }

    public boolean hasDigestHa1() {
        return digestHa1 != null && !digestHa1.isEmpty();
    }

    @Override
    public String toString() {
        return "User{id='" + id + "', username='" + username + "'}";
    }
}
