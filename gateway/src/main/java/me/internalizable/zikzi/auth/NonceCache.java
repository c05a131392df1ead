package me.internalizable.zikzi.auth;

import com.google.common.io.BaseEncoding;
import me.internalizable.zikzi.scheduler.GatewayScheduler;
import me.internalizable.zikzi.scheduler.ScheduledTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Issues and checks the nonces of HTTP Digest challenges.
 *
 * <p>Nonces are 16 random bytes in lowercase hex and stay valid for five minutes. They are
 * kept in memory only, so a restart invalidates all outstanding challenges. Expired
 * entries are swept once a minute.</p>
 *
 * <p>Thread-safe.</p>
 */
public final class NonceCache implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(NonceCache.class);

    public static final Duration NONCE_TTL = Duration.ofMinutes(5);
    public static final Duration SWEEP_INTERVAL = Duration.ofMinutes(1);

    private static final int NONCE_BYTES = 16;

    private final Map<String, Instant> nonces = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final SecureRandom random = new SecureRandom();
    private final Clock clock;

    private ScheduledTask sweepTask;

    /**
     * Creates a cache without a background sweep; {@link #sweep()} must be called by the owner.
     */
    public NonceCache(@Nonnull Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates a cache and registers its periodic sweep with the scheduler.
     */
    public NonceCache(@Nonnull Clock clock, @Nonnull GatewayScheduler scheduler) {
        this(clock);
        Objects.requireNonNull(scheduler, "scheduler");
        long period = SWEEP_INTERVAL.toMillis();
        this.sweepTask = scheduler.runRepeating("nonce-cache", this::sweep, period, period, TimeUnit.MILLISECONDS);
    }

    /**
     * Generates and remembers a fresh nonce.
     */
    @Nonnull
    public String generate() {
        byte[] bytes = new byte[NONCE_BYTES];
        random.nextBytes(bytes);
        String nonce = BaseEncoding.base16().lowerCase().encode(bytes);

        lock.writeLock().lock();
        try {
            nonces.put(nonce, clock.instant().plus(NONCE_TTL));
        } finally {
            lock.writeLock().unlock();
        }
        return nonce;
    }

    /**
     * Whether the nonce was issued by this cache and has not expired yet.
     */
    public boolean isValid(@Nullable String nonce) {
        if (nonce == null || nonce.isEmpty()) {
            return false;
        }
        lock.readLock().lock();
        try {
            Instant expiry = nonces.get(nonce);
            return expiry != null && clock.instant().isBefore(expiry);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void invalidate(@Nonnull String nonce) {
        lock.writeLock().lock();
        try {
            nonces.remove(nonce);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes every expired nonce.
     *
     * @return the number of removed entries
     */
    public int sweep() {
        Instant now = clock.instant();
        int removed = 0;
        lock.writeLock().lock();
        try {
            Iterator<Map.Entry<String, Instant>> it = nonces.entrySet().iterator();
            while (it.hasNext()) {
                if (!now.isBefore(it.next().getValue())) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (removed > 0) {
            LOGGER.debug("Swept {} expired digest nonces", removed);
        }
        return removed;
    }

    /**
     * Stops the periodic sweep. Outstanding nonces stay valid until they expire.
     */
    @Override
    public void close() {
        if (sweepTask != null) {
            sweepTask.cancel();
            sweepTask = null;
        }
    }
}
