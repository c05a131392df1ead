package me.internalizable.zikzi.store;

import javax.annotation.Nonnull;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Objects;

/**
 * Generates 12-character base62 ids: 7 characters of milliseconds since 2024-01-01 UTC
 * followed by 5 characters of randomness mixed with a per-millisecond counter.
 *
 * <p>Ids created in later milliseconds sort after earlier ones.</p>
 */
public final class ShortIdGenerator {

    static final String ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz";

    // 2024-01-01T00:00:00Z
    static final long EPOCH_MILLIS = 1704067200000L;

    public static final int LENGTH = 12;

    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    private long lastMillis = -1;
    private int counter;

    public ShortIdGenerator(@Nonnull Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Nonnull
    public String next() {
        long now;
        int c;
        synchronized (this) {
            now = clock.millis() - EPOCH_MILLIS;
            if (now == lastMillis) {
                counter = (counter + 1) & 0xFFFF;
            } else {
                counter = 0;
                lastMillis = now;
            }
            c = counter;
        }

        char[] id = new char[LENGTH];
        long timestamp = Math.max(now, 0);
        for (int i = 6; i >= 0; i--) {
            id[i] = ALPHABET.charAt((int) (timestamp % 62));
            timestamp /= 62;
        }

        long mixed = (((random.nextInt() & 0xFFFFFFFFL) << 16) | c) & 0xFFFFFFFFL;
        for (int i = LENGTH - 1; i >= 7; i--) {
            id[i] = ALPHABET.charAt((int) (mixed % 62));
            mixed /= 62;
        }
        return new String(id);
    }

    /**
     * Whether the string has the length and alphabet of a generated id.
     */
    public static boolean isValid(String id) {
        if (id == null || id.length() != LENGTH) {
            return false;
        }
        for (int i = 0; i < id.length(); i++) {
            if (ALPHABET.indexOf(id.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }
}
