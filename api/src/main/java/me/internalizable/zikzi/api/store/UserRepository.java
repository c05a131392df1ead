package me.internalizable.zikzi.api.store;

import me.internalizable.zikzi.api.model.User;

import javax.annotation.Nonnull;
import java.util.Optional;

/**
 * Read access to user accounts.
 */
public interface UserRepository {

    @Nonnull
    Optional<User> findByUsername(@Nonnull String username);
}
