package me.internalizable.zikzi.api.auth;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Outcome of authenticating one request.
 *
 * <p>Immutable. An unauthenticated result carries neither a user nor a method.</p>
 */
public final class AuthResult {

    private static final AuthResult UNAUTHENTICATED = new AuthResult(false, null, null);

    private final boolean authenticated;
    private final String userId;
    private final AuthMethod method;

    private AuthResult(boolean authenticated, @Nullable String userId, @Nullable AuthMethod method) {
        this.authenticated = authenticated;
        this.userId = userId;
        this.method = method;
    }

    @Nonnull
    public static AuthResult authenticated(@Nonnull String userId, @Nonnull AuthMethod method) {
        return new AuthResult(true,
                Objects.requireNonNull(userId, "userId"),
                Objects.requireNonNull(method, "method"));
    }

    @Nonnull
    public static AuthResult unauthenticated() {
        return UNAUTHENTICATED;
    }

    public boolean isAuthenticated() {
        return authenticated;
    }

    @Nullable
    public String getUserId() {
        return userId;
    }

    @Nullable
    public AuthMethod getMethod() {
        return method;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AuthResult)) return false;
        AuthResult that = (AuthResult) o;
        return authenticated == that.authenticated
                && Objects.equals(userId, that.userId)
                && method == that.method;
    }

    @Override
    public int hashCode() {
        return Objects.hash(authenticated, userId, method);
    }

    @Override
    public String toString() {
        return authenticated
                ? "AuthResult{user='" + userId + "', method=" + method.getId() + '}'
                : "AuthResult{unauthenticated}";
    }
}
