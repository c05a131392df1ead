package me.internalizable.zikzi.api.auth;

import javax.annotation.Nonnull;

/**
 * How a request was attributed to a user.
 */
public enum AuthMethod {

    /** The client IP matched an active IP registration. */
    IP("ip"),

    /** HTTP Basic with an account password or a token. */
    BASIC("basic"),

    /** HTTP Digest with a pre-computed HA1 or a token. */
    DIGEST("digest");

    private final String id;

    AuthMethod(String id) {
        this.id = id;
    }

    @Nonnull
    public String getId() {
        return id;
    }
}
