package me.internalizable.zikzi.auth;

import com.google.common.io.BaseEncoding;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.Map;

import static com.google.common.base.Strings.nullToEmpty;

/**
 * HTTP Digest (RFC 2617, MD5) helpers.
 */
public final class DigestAuth {

    private DigestAuth() {
    }

    /**
     * Parses the parameter list of a {@code Digest} authorization header.
     *
     * <p>Pairs are separated by commas and split on the first {@code =}; surrounding double
     * quotes are removed from values. Quoted values that themselves contain commas are not
     * supported, which is fine for the parameters that matter here.</p>
     *
     * @param params the header value after the {@code Digest } scheme
     */
    @Nonnull
    public static Map<String, String> parseParams(@Nonnull String params) {
        Map<String, String> result = new HashMap<>();
        for (String part : params.split(",")) {
            String trimmed = part.trim();
            int idx = trimmed.indexOf('=');
            if (idx == -1) {
                continue;
            }
            String key = trimmed.substring(0, idx).trim();
            String value = trimmed.substring(idx + 1).trim();
            if (value.length() >= 2 && value.charAt(0) == '"' && value.charAt(value.length() - 1) == '"') {
                value = value.substring(1, value.length() - 1);
            }
            result.put(key, value);
        }
        return result;
    }

    /**
     * HA1 = MD5(username:realm:secret), lowercase hex.
     */
    @Nonnull
    public static String ha1(@Nonnull String username, @Nonnull String realm, @Nonnull String secret) {
        return md5Hex(username + ":" + realm + ":" + secret);
    }

    /**
     * Expected client response for the given HA1 and challenge parameters.
     *
     * <p>With qop {@code auth} or {@code auth-int} the response covers nc, cnonce and qop;
     * otherwise the RFC 2069 form {@code MD5(HA1:nonce:HA2)} is used. HA2 is always
     * {@code MD5(method:uri)}.</p>
     */
    @Nonnull
    public static String response(@Nonnull String ha1, @Nonnull String nonce, @Nullable String nc,
                                  @Nullable String cnonce, @Nullable String qop,
                                  @Nonnull String method, @Nonnull String uri) {
        String ha2 = md5Hex(method + ":" + uri);
        if ("auth".equals(qop) || "auth-int".equals(qop)) {
            return md5Hex(ha1 + ":" + nonce + ":" + nullToEmpty(nc) + ":" + nullToEmpty(cnonce) + ":" + qop + ":" + ha2);
        }
        return md5Hex(ha1 + ":" + nonce + ":" + ha2);
    }

    /**
     * Compares two secrets in time independent of where they differ.
     */
    public static boolean constantTimeEquals(@Nullable String expected, @Nullable String actual) {
        if (expected == null || actual == null) {
            return false;
        }
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8),
            actual.getBytes(StandardCharsets.UTF_8));
    }

    // MD5 is the algorithm of the Digest scheme; every JDK ships it
    static String md5Hex(String input) {
        MessageDigest md5;
        try {
            md5 = MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 is not available", e);
        }
        return BaseEncoding.base16().lowerCase().encode(md5.digest(input.getBytes(StandardCharsets.UTF_8)));
    }
}
