package me.internalizable.zikzi.auth;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * The parts of an HTTP request that authentication looks at.
 */
public final class AuthRequest {

    private final String method;
    private final String authorization;

    public AuthRequest(@Nonnull String method, @Nullable String authorization) {
        this.method = Objects.requireNonNull(method, "method");
        this.authorization = authorization;
    }

    @Nonnull
    public String getMethod() {
        return method;
    }

    /**
     * The raw {@code Authorization} header, or null when absent.
     */
    @Nullable
    public String getAuthorization() {
        return authorization;
    }
}
