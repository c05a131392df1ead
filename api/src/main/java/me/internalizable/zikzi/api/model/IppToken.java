package me.internalizable.zikzi.api.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;

/**
 * A per-user secret accepted in place of the account password on the printing protocols.
 *
 * <p>The value is kept in plain text because Digest authentication needs it to compute
 * {@code MD5(username:realm:token)} on every request.</p>
 */
public class IppToken {

    private String id;
    private String userId;
    private String name;
    private String token;
    private Instant lastUsedAt;
    private String lastUsedIp;
    private Instant expiresAt;
    private boolean active = true;

    public IppToken() {
    }

    public IppToken(String id, String userId, String token) {
        this.id = id;
        this.userId = userId;
        this.token = token;
    }

    public boolean isExpired(@Nonnull Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    /**
     * @return true if the token is active and not expired at {@code now}
     */
    public boolean isValid(@Nonnull Instant now) {
        return active && !isExpired(now);
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }

    @Nullable
    public Instant getLastUsedAt() { return lastUsedAt; }
    public void setLastUsedAt(@Nullable Instant lastUsedAt) { this.lastUsedAt = lastUsedAt; }

    @Nullable
    public String getLastUsedIp() { return lastUsedIp; }
    public void setLastUsedIp(@Nullable String lastUsedIp) { this.lastUsedIp = lastUsedIp; }

    @Nullable
    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(@Nullable Instant expiresAt) { this.expiresAt = expiresAt; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
}
