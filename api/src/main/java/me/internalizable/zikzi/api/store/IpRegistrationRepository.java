package me.internalizable.zikzi.api.store;

import me.internalizable.zikzi.api.model.IpRegistration;

import javax.annotation.Nonnull;
import java.time.Instant;
import java.util.Optional;

/**
 * Read access to IP registrations.
 */
public interface IpRegistrationRepository {

    /**
     * Finds the registration for an address if it is active and not expired.
     *
     * @param ipAddress the textual client address
     * @param now       the instant expiry is evaluated against
     */
    @Nonnull
    Optional<IpRegistration> findUsable(@Nonnull String ipAddress, @Nonnull Instant now);
}
