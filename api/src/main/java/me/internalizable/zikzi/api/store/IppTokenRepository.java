package me.internalizable.zikzi.api.store;

import me.internalizable.zikzi.api.model.IppToken;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.List;

/**
 * Access to a user's printing tokens.
 */
public interface IppTokenRepository {

    /**
     * Returns the user's tokens that are active and not expired at {@code now}.
     */
    @Nonnull
    List<IppToken> findValidByUserId(@Nonnull String userId, @Nonnull Instant now);

    /**
     * Writes back a token, used to record {@link IppToken#getLastUsedAt()}.
     */
    void save(@Nonnull IppToken token);
}
