package me.internalizable.zikzi.auth;

import com.google.common.io.BaseEncoding;
import me.internalizable.zikzi.api.auth.AuthMethod;
import me.internalizable.zikzi.api.auth.AuthResult;
import me.internalizable.zikzi.api.model.IpRegistration;
import me.internalizable.zikzi.api.model.IppToken;
import me.internalizable.zikzi.api.model.User;
import me.internalizable.zikzi.api.store.IpRegistrationRepository;
import me.internalizable.zikzi.api.store.IppTokenRepository;
import me.internalizable.zikzi.api.store.StoreException;
import me.internalizable.zikzi.api.store.UserRepository;
import me.internalizable.zikzi.config.IppAuthConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Attributes an IPP request to a user.
 *
 * <h2>Order</h2>
 * <ol>
 *   <li>IP registration of the client address, when IP auth is enabled</li>
 *   <li>HTTP {@code Basic} (password or printing token) or {@code Digest} (stored HA1 or
 *       printing token), when login auth is enabled. A missing or failed header asks the
 *       caller to challenge</li>
 *   <li>otherwise unauthenticated without a challenge</li>
 * </ol>
 *
 * <p>Secrets are compared in constant time. A successful token login records
 * {@link IppToken#getLastUsedAt()}.</p>
 */
public class AuthResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(AuthResolver.class);

    private static final String BASIC_PREFIX = "Basic ";
    private static final String DIGEST_PREFIX = "Digest ";

    private final IppAuthConfig config;
    private final UserRepository users;
    private final IpRegistrationRepository ipRegistrations;
    private final IppTokenRepository tokens;
    private final NonceCache nonceCache;
    private final PasswordVerifier passwordVerifier;
    private final Clock clock;

    public AuthResolver(@Nonnull IppAuthConfig config,
                        @Nonnull UserRepository users,
                        @Nonnull IpRegistrationRepository ipRegistrations,
                        @Nonnull IppTokenRepository tokens,
                        @Nonnull NonceCache nonceCache,
                        @Nonnull PasswordVerifier passwordVerifier,
                        @Nonnull Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.users = Objects.requireNonNull(users, "users");
        this.ipRegistrations = Objects.requireNonNull(ipRegistrations, "ipRegistrations");
        this.tokens = Objects.requireNonNull(tokens, "tokens");
        this.nonceCache = Objects.requireNonNull(nonceCache, "nonceCache");
        this.passwordVerifier = Objects.requireNonNull(passwordVerifier, "passwordVerifier");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Nonnull
    public AuthOutcome resolve(@Nonnull AuthRequest request, @Nonnull String clientIp) {
        if (config.isAllowIp()) {
            Optional<IpRegistration> registration = ipRegistrations.findUsable(clientIp, clock.instant());
            if (registration.isPresent()) {
                return new AuthOutcome(AuthResult.authenticated(registration.get().getUserId(), AuthMethod.IP), false);
            }
        }

        if (config.isAllowLogin()) {
            String header = request.getAuthorization();
            if (header != null) {
                if (header.startsWith(BASIC_PREFIX)) {
                    User user = authenticateBasic(header.substring(BASIC_PREFIX.length()));
                    if (user != null) {
                        return new AuthOutcome(AuthResult.authenticated(user.getId(), AuthMethod.BASIC), false);
                    }
                } else if (header.startsWith(DIGEST_PREFIX)) {
                    User user = authenticateDigest(request.getMethod(), header.substring(DIGEST_PREFIX.length()));
                    if (user != null) {
                        return new AuthOutcome(AuthResult.authenticated(user.getId(), AuthMethod.DIGEST), false);
                    }
                }
            }
            return new AuthOutcome(AuthResult.unauthenticated(), true);
        }

        return new AuthOutcome(AuthResult.unauthenticated(), false);
    }

    /**
     * Builds the {@code WWW-Authenticate} values of a 401 challenge, Basic first. Each call
     * issues a fresh digest nonce.
     */
    @Nonnull
    public List<String> challenge() {
        String realm = config.getRealm();
        return List.of(
            "Basic realm=\"" + realm + "\"",
            "Digest realm=\"" + realm + "\", nonce=\"" + nonceCache.generate() + "\", qop=\"auth\", algorithm=MD5"
        );
    }

    // ==================== Basic ====================

    @Nullable
    private User authenticateBasic(String encoded) {
        String decoded;
        try {
            decoded = new String(BaseEncoding.base64().decode(encoded.trim()), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            LOGGER.debug("Basic auth failed - malformed credentials");
            return null;
        }

        int colon = decoded.indexOf(':');
        if (colon < 0) {
            return null;
        }
        String username = decoded.substring(0, colon);
        String credential = decoded.substring(colon + 1);

        User user = users.findByUsername(username).orElse(null);
        if (user == null) {
            LOGGER.debug("Basic auth failed - user not found: {}", username);
            return null;
        }

        if (user.hasPasswordHash() && user.isAllowIppPassword()
                && passwordVerifier.verify(user.getPasswordHash(), credential)) {
            return user;
        }

        Instant now = clock.instant();
        for (IppToken token : tokens.findValidByUserId(user.getId(), now)) {
            if (DigestAuth.constantTimeEquals(token.getToken(), credential)) {
                markUsed(token, now);
                LOGGER.debug("Basic auth succeeded for user {} via token", username);
                return user;
            }
        }

        LOGGER.debug("Basic auth failed - no credential matched for user {}", username);
        return null;
    }

    // ==================== Digest ====================

    @Nullable
    private User authenticateDigest(String method, String paramList) {
        Map<String, String> params = DigestAuth.parseParams(paramList);
        String username = params.get("username");
        String nonce = params.get("nonce");
        String uri = params.getOrDefault("uri", "");
        String clientResponse = params.get("response");
        String nc = params.get("nc");
        String cnonce = params.get("cnonce");
        String qop = params.get("qop");

        if (!nonceCache.isValid(nonce)) {
            LOGGER.debug("Digest auth failed - invalid or expired nonce");
            return null;
        }
        if (username == null || clientResponse == null) {
            return null;
        }

        User user = users.findByUsername(username).orElse(null);
        if (user == null) {
            LOGGER.debug("Digest auth failed - user not found: {}", username);
            return null;
        }

        if (user.hasDigestHa1() && user.isAllowIppPassword()) {
            String expected = DigestAuth.response(user.getDigestHa1(), nonce, nc, cnonce, qop, method, uri);
            if (DigestAuth.constantTimeEquals(expected, clientResponse)) {
                LOGGER.debug("Digest auth succeeded for user {} via password", username);
                return user;
            }
        }

        Instant now = clock.instant();
        String realm = config.getRealm();
        for (IppToken token : tokens.findValidByUserId(user.getId(), now)) {
            String ha1 = DigestAuth.ha1(username, realm, token.getToken());
            String expected = DigestAuth.response(ha1, nonce, nc, cnonce, qop, method, uri);
            if (DigestAuth.constantTimeEquals(expected, clientResponse)) {
                markUsed(token, now);
                LOGGER.debug("Digest auth succeeded for user {} via token", username);
                return user;
            }
        }

        LOGGER.debug("Digest auth failed - no credential matched for user {}", username);
        return null;
    }

    private void markUsed(IppToken token, Instant now) {
        token.setLastUsedAt(now);
        try {
            tokens.save(token);
        } catch (StoreException e) {
            LOGGER.warn("Failed to record use of token {}", token.getId(), e);
        }
    }
}
