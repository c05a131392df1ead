package me.internalizable.zikzi.auth;

import com.google.common.io.BaseEncoding;
import me.internalizable.zikzi.MutableClock;
import me.internalizable.zikzi.api.auth.AuthMethod;
import me.internalizable.zikzi.api.model.IpRegistration;
import me.internalizable.zikzi.api.model.IppToken;
import me.internalizable.zikzi.api.model.User;
import me.internalizable.zikzi.config.IppAuthConfig;
import me.internalizable.zikzi.store.InMemoryPrintStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AuthResolverTest {

    private static final String REALM = "zikzi";

    private MutableClock clock;
    private InMemoryPrintStore store;
    private NonceCache nonceCache;
    private IppAuthConfig config;
    private AuthResolver resolver;

    @BeforeEach
    void initObjectUnderTest() {
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        store = new InMemoryPrintStore(clock);
        nonceCache = new NonceCache(clock);
        config = new IppAuthConfig();
        config.setAllowIp(true);
        config.setAllowLogin(true);
        config.setRealm(REALM);

        User alice = new User("u1", "alice");
        alice.setPasswordHash("hash:T1");
        alice.setDigestHa1(DigestAuth.ha1("alice", REALM, "T1"));
        store.addUser(alice);

        resolver = new AuthResolver(config, store, store, store, nonceCache,
            (storedHash, password) -> storedHash.equals("hash:" + password), clock);
    }

    @Test
    void registeredIpIsAuthenticatedWithoutHeader() {
        store.addIpRegistration(new IpRegistration("r1", "u1", "192.168.1.20"));

        AuthOutcome outcome = resolver.resolve(new AuthRequest("POST", null), "192.168.1.20");

        assertThat(outcome.getResult().isAuthenticated()).isTrue();
        assertThat(outcome.getResult().getUserId()).isEqualTo("u1");
        assertThat(outcome.getResult().getMethod()).isEqualTo(AuthMethod.IP);
        assertThat(outcome.isMustChallenge()).isFalse();
    }

    @Test
    void expiredRegistrationFallsThroughToChallenge() {
        IpRegistration registration = new IpRegistration("r1", "u1", "192.168.1.20");
        registration.setExpiresAt(clock.instant().minusSeconds(1));
        store.addIpRegistration(registration);

        AuthOutcome outcome = resolver.resolve(new AuthRequest("POST", null), "192.168.1.20");

        assertThat(outcome.getResult().isAuthenticated()).isFalse();
        assertThat(outcome.isMustChallenge()).isTrue();
    }

    @Test
    void missingHeaderWithLoginDisabledIsAnonymousWithoutChallenge() {
        config.setAllowLogin(false);

        AuthOutcome outcome = resolver.resolve(new AuthRequest("POST", null), "10.0.0.9");

        assertThat(outcome.getResult().isAuthenticated()).isFalse();
        assertThat(outcome.isMustChallenge()).isFalse();
    }

    @Test
    void basicWithPasswordAuthenticates() {
        AuthOutcome outcome = resolver.resolve(new AuthRequest("POST", basic("alice", "T1")), "10.0.0.9");

        assertThat(outcome.getResult().getUserId()).isEqualTo("u1");
        assertThat(outcome.getResult().getMethod()).isEqualTo(AuthMethod.BASIC);
    }

    @Test
    void basicPasswordIsRefusedWhenIppPasswordDisallowed() {
        store.findByUsername("alice").get().setAllowIppPassword(false);

        AuthOutcome outcome = resolver.resolve(new AuthRequest("POST", basic("alice", "T1")), "10.0.0.9");

        assertThat(outcome.getResult().isAuthenticated()).isFalse();
        assertThat(outcome.isMustChallenge()).isTrue();
    }

    @Test
    void basicWithTokenAuthenticatesAndRecordsUse() {
        // Given
        store.findByUsername("alice").get().setAllowIppPassword(false);
        IppToken token = new IppToken("t1", "u1", "abc123");
        store.save(token);

        // When
        AuthOutcome outcome = resolver.resolve(new AuthRequest("POST", basic("alice", "abc123")), "10.0.0.9");

        // Then
        assertThat(outcome.getResult().getMethod()).isEqualTo(AuthMethod.BASIC);
        assertThat(token.getLastUsedAt()).isEqualTo(clock.instant());
    }

    @Test
    void basicWithExpiredTokenIsChallenged() {
        IppToken token = new IppToken("t1", "u1", "abc123");
        token.setExpiresAt(clock.instant().minusSeconds(60));
        store.save(token);

        AuthOutcome outcome = resolver.resolve(new AuthRequest("POST", basic("alice", "abc123")), "10.0.0.9");

        assertThat(outcome.getResult().isAuthenticated()).isFalse();
        assertThat(outcome.isMustChallenge()).isTrue();
    }

    @Test
    void malformedBasicIsChallenged() {
        AuthOutcome outcome = resolver.resolve(new AuthRequest("POST", "Basic !!!not-base64"), "10.0.0.9");

        assertThat(outcome.getResult().isAuthenticated()).isFalse();
        assertThat(outcome.isMustChallenge()).isTrue();
    }

    @Test
    void digestWithStoredHa1Authenticates() {
        // Given
        String nonce = issuedNonce();
        String ha1 = DigestAuth.ha1("alice", REALM, "T1");
        String response = DigestAuth.response(ha1, nonce, "00000001", "xyz", "auth", "POST", "/ipp/print");

        // When
        AuthOutcome outcome = resolver.resolve(
            new AuthRequest("POST", digest("alice", nonce, "/ipp/print", response)), "10.0.0.9");

        // Then
        assertThat(outcome.getResult().getUserId()).isEqualTo("u1");
        assertThat(outcome.getResult().getMethod()).isEqualTo(AuthMethod.DIGEST);
    }

    @Test
    void digestWithTamperedResponseIsChallenged() {
        String nonce = issuedNonce();
        String ha1 = DigestAuth.ha1("alice", REALM, "T1");
        String response = DigestAuth.response(ha1, nonce, "00000001", "xyz", "auth", "POST", "/ipp/print");
        String tampered = (response.charAt(0) == '0' ? "1" : "0") + response.substring(1);

        AuthOutcome outcome = resolver.resolve(
            new AuthRequest("POST", digest("alice", nonce, "/ipp/print", tampered)), "10.0.0.9");

        assertThat(outcome.getResult().isAuthenticated()).isFalse();
        assertThat(outcome.isMustChallenge()).isTrue();
    }

    @Test
    void digestWithUnknownNonceIsChallenged() {
        String nonce = "0123456789abcdef0123456789abcdef";
        String ha1 = DigestAuth.ha1("alice", REALM, "T1");
        String response = DigestAuth.response(ha1, nonce, "00000001", "xyz", "auth", "POST", "/ipp/print");

        AuthOutcome outcome = resolver.resolve(
            new AuthRequest("POST", digest("alice", nonce, "/ipp/print", response)), "10.0.0.9");

        assertThat(outcome.isMustChallenge()).isTrue();
    }

    @Test
    void digestWithTokenAuthenticates() {
        // Given
        User bob = new User("u2", "bob");
        store.addUser(bob);
        IppToken token = new IppToken("t2", "u2", "tok-42");
        store.save(token);
        String nonce = issuedNonce();
        String ha1 = DigestAuth.ha1("bob", REALM, "tok-42");
        String response = DigestAuth.response(ha1, nonce, "00000002", "c1", "auth", "POST", "/");

        // When
        AuthOutcome outcome = resolver.resolve(
            new AuthRequest("POST", digest("bob", nonce, "/", "00000002", "c1", response)), "10.0.0.9");

        // Then
        assertThat(outcome.getResult().getUserId()).isEqualTo("u2");
        assertThat(token.getLastUsedAt()).isEqualTo(clock.instant());
    }

    @Test
    void challengeOffersBasicAndDigestWithFreshNonce() {
        List<String> challenge = resolver.challenge();

        assertThat(challenge).hasSize(2);
        assertThat(challenge.get(0)).isEqualTo("Basic realm=\"zikzi\"");
        assertThat(challenge.get(1)).startsWith("Digest realm=\"zikzi\", nonce=\"")
            .endsWith("\", qop=\"auth\", algorithm=MD5");

        Map<String, String> params = DigestAuth.parseParams(challenge.get(1).substring("Digest ".length()));
        assertThat(nonceCache.isValid(params.get("nonce"))).isTrue();
    }

    private String issuedNonce() {
        return DigestAuth.parseParams(resolver.challenge().get(1).substring("Digest ".length())).get("nonce");
    }

    private static String basic(String username, String secret) {
        return "Basic " + BaseEncoding.base64().encode((username + ":" + secret).getBytes(StandardCharsets.UTF_8));
    }

    private static String digest(String username, String nonce, String uri, String response) {
        return digest(username, nonce, uri, "00000001", "xyz", response);
    }

    private static String digest(String username, String nonce, String uri, String nc, String cnonce,
                                 String response) {
        return "Digest username=\"" + username + "\", realm=\"" + REALM + "\", nonce=\"" + nonce
            + "\", uri=\"" + uri + "\", qop=auth, nc=" + nc + ", cnonce=\"" + cnonce
            + "\", response=\"" + response + "\"";
    }
}
