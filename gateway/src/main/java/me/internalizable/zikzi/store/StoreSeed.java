package me.internalizable.zikzi.store;

import me.internalizable.zikzi.api.model.IpRegistration;
import me.internalizable.zikzi.api.model.IppToken;
import me.internalizable.zikzi.api.model.User;
import me.internalizable.zikzi.auth.DigestAuth;
import org.mindrot.jbcrypt.BCrypt;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Users, IP registrations and printing tokens to load into an {@link InMemoryPrintStore}.
 *
 * <pre>
 * users:
 *   - id: u1
 *     username: alice
 *     password: secret        # hashed with bcrypt, HA1 derived for the realm
 * ipRegistrations:
 *   - userId: u1
 *     ipAddress: 192.168.1.20
 *     expiresAt: 2030-01-01T00:00:00Z
 * tokens:
 *   - userId: u1
 *     name: laptop
 *     token: abc123
 * </pre>
 */
public class StoreSeed {

    private List<UserEntry> users = new ArrayList<>();
    private List<IpEntry> ipRegistrations = new ArrayList<>();
    private List<TokenEntry> tokens = new ArrayList<>();

    @Nonnull
    public static StoreSeed load(@Nonnull Path path) throws IOException {
        Yaml yaml = new Yaml(new Constructor(StoreSeed.class, new LoaderOptions()));
        try (InputStream is = Files.newInputStream(path)) {
            StoreSeed seed = yaml.load(is);
            return seed != null ? seed : new StoreSeed();
        }
    }

    public List<UserEntry> getUsers() { return users; }
    public void setUsers(List<UserEntry> users) { this.users = users != null ? users : new ArrayList<>(); }

    public List<IpEntry> getIpRegistrations() { return ipRegistrations; }
    public void setIpRegistrations(List<IpEntry> ipRegistrations) {
        this.ipRegistrations = ipRegistrations != null ? ipRegistrations : new ArrayList<>();
    }

    public List<TokenEntry> getTokens() { return tokens; }
    public void setTokens(List<TokenEntry> tokens) { this.tokens = tokens != null ? tokens : new ArrayList<>(); }

    // ==================== Entries ====================

    public static class UserEntry {
        private String id;
        private String username;
        private String displayName;
        private String password;
        private String passwordHash;
        private String digestHa1;
        private boolean allowIppPassword = true;

        User toUser(String realm) {
            User user = new User(id != null ? id : username, username);
            user.setDisplayName(displayName);
            user.setAllowIppPassword(allowIppPassword);
            user.setPasswordHash(passwordHash);
            user.setDigestHa1(digestHa1);
            if (password != null && !password.isEmpty()) {
                if (passwordHash == null) {
                    user.setPasswordHash(BCrypt.hashpw(password, BCrypt.gensalt()));
                }
                if (digestHa1 == null) {
                    user.setDigestHa1(DigestAuth.ha1(username, realm, password));
                }
            }
            return user;
        }

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getDisplayName() { return displayName; }
        public void setDisplayName(String displayName) { this.displayName = displayName; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public String getPasswordHash() { return passwordHash; }
        public void setPasswordHash(String passwordHash) { this.passwordHash = passwordHash; }

        public String getDigestHa1() { return digestHa1; }
        public void setDigestHa1(String digestHa1) { this.digestHa1 = digestHa1; }

        public boolean isAllowIppPassword() { return allowIppPassword; }
        public void setAllowIppPassword(boolean allowIppPassword) { this.allowIppPassword = allowIppPassword; }
    }

    public static class IpEntry {
        private String userId;
        private String ipAddress;
        private String description;
        private boolean active = true;
        private Date expiresAt;

        IpRegistration toRegistration(String id) {
            IpRegistration registration = new IpRegistration(id, userId, ipAddress);
            registration.setDescription(description);
            registration.setActive(active);
            registration.setExpiresAt(expiresAt != null ? expiresAt.toInstant() : null);
            return registration;
        }

        public String getUserId() { return userId; }
        public void setUserId(String userId) { this.userId = userId; }

        public String getIpAddress() { return ipAddress; }
        public void setIpAddress(String ipAddress) { this.ipAddress = ipAddress; }

        public String getDescription() { return description; }
        public void setDescription(String description) { this.description = description; }

        public boolean isActive() { return active; }
        public void setActive(boolean active) { this.active = active; }

        public Date getExpiresAt() { return expiresAt; }
        public void setExpiresAt(Date expiresAt) { this.expiresAt = expiresAt; }
    }

    public static class TokenEntry {
        private String userId;
        private String name;
        private String token;
        private boolean active = true;
        private Date expiresAt;

        IppToken toToken(String id) {
            IppToken ippToken = new IppToken(id, userId, token);
            ippToken.setName(name);
            ippToken.setActive(active);
            ippToken.setExpiresAt(expiresAt != null ? expiresAt.toInstant() : null);
            return ippToken;
        }

        public String getUserId() { return userId; }
        public void setUserId(String userId) { this.userId = userId; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getToken() { return token; }
        public void setToken(String token) { this.token = token; }

        public boolean isActive() { return active; }
        public void setActive(boolean active) { this.active = active; }

        public Date getExpiresAt() { return expiresAt; }
        public void setExpiresAt(Date expiresAt) { this.expiresAt = expiresAt; }
    }
}
