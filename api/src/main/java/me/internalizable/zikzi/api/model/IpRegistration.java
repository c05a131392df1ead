package me.internalizable.zikzi.api.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;

/**
 * Binds a client IP address to a user, so that documents sent from that address are
 * attributed without credentials.
 */
public class IpRegistration {

    private String id;
    private String userId;
    private String ipAddress;
    private String description;
    private Instant expiresAt;
    private boolean active = true;

    public IpRegistration() {
    }

    public IpRegistration(String id, String userId, String ipAddress) {
        this.id = id;
        this.userId = userId;
        this.ipAddress = ipAddress;
    }

    /**
     * @return true if the registration is active and has not expired at {@code now}
     */
    public boolean isUsable(@Nonnull Instant now) {
        return active && (expiresAt == null || now.isBefore(expiresAt));
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    public String getIpAddress() { return ipAddress; }
    public void setIpAddress(String ipAddress) { this.ipAddress = ipAddress; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    @Nullable
    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(@Nullable Instant expiresAt) { this.expiresAt = expiresAt; }

    public boolean isActive() { return active; }
    public void setActive(boolean active) { this.active = active; }
}
