package me.internalizable.zikzi.auth;

import me.internalizable.zikzi.api.auth.AuthResult;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Result of {@link AuthResolver#resolve}: who the caller is, and whether an unauthenticated
 * caller should be answered with a 401 challenge.
 */
public final class AuthOutcome {

    private final AuthResult result;
    private final boolean mustChallenge;

    public AuthOutcome(@Nonnull AuthResult result, boolean mustChallenge) {
        this.result = Objects.requireNonNull(result, "result");
        this.mustChallenge = mustChallenge;
    }

    @Nonnull
    public AuthResult getResult() {
        return result;
    }

    public boolean isMustChallenge() {
        return mustChallenge;
    }

    @Override
    public String toString() {
        return "AuthOutcome{result=" + result + ", mustChallenge=" + mustChallenge + '}';
    }
}
