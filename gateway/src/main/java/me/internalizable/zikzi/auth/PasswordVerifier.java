package me.internalizable.zikzi.auth;

import javax.annotation.Nonnull;

/**
 * Checks a plaintext password against a stored hash.
 */
@FunctionalInterface
public interface PasswordVerifier {

    /**
     * @return true if the password matches; a malformed hash never matches
     */
    boolean verify(@Nonnull String storedHash, @Nonnull String password);
}
