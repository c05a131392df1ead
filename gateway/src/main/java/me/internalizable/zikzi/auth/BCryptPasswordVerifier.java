package me.internalizable.zikzi.auth;

import org.mindrot.jbcrypt.BCrypt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

/**
 * Verifies bcrypt password hashes.
 */
public final class BCryptPasswordVerifier implements PasswordVerifier {

    private static final Logger LOGGER = LoggerFactory.getLogger(BCryptPasswordVerifier.class);

    @Override
    public boolean verify(@Nonnull String storedHash, @Nonnull String password) {
        try {
            return BCrypt.checkpw(password, storedHash);
        } catch (IllegalArgumentException e) {
            LOGGER.warn("Stored password hash is not a valid bcrypt hash: {}", e.getMessage());
            return false;
        }
    }
}
