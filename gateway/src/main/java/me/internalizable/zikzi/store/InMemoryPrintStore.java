package me.internalizable.zikzi.store;

import me.internalizable.zikzi.api.model.IpRegistration;
import me.internalizable.zikzi.api.model.IppToken;
import me.internalizable.zikzi.api.model.JobStatus;
import me.internalizable.zikzi.api.model.PrintJob;
import me.internalizable.zikzi.api.model.User;
import me.internalizable.zikzi.api.store.IpRegistrationRepository;
import me.internalizable.zikzi.api.store.IppTokenRepository;
import me.internalizable.zikzi.api.store.PrintJobRepository;
import me.internalizable.zikzi.api.store.StoreException;
import me.internalizable.zikzi.api.store.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Thread-safe in-memory implementation of all repositories, used when the gateway runs
 * without an external database.
 *
 * <p>Jobs are stored as copies so callers never share mutable state with the store.
 * Users, IP registrations and tokens come from a seed file and are otherwise read-only,
 * except for token usage updates.</p>
 */
public class InMemoryPrintStore implements PrintJobRepository, UserRepository,
        IpRegistrationRepository, IppTokenRepository {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryPrintStore.class);

    private final Clock clock;
    private final ShortIdGenerator idGenerator;
    private final AtomicLong sequence = new AtomicLong();

    private final Map<String, StoredJob> jobs = new ConcurrentHashMap<>();
    private final Map<String, User> usersByName = new ConcurrentHashMap<>();
    private final Map<String, IpRegistration> registrationsByIp = new ConcurrentHashMap<>();
    private final Map<String, IppToken> tokensById = new ConcurrentHashMap<>();

    public InMemoryPrintStore(@Nonnull Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.idGenerator = new ShortIdGenerator(clock);
    }

    // ==================== Print Jobs ====================

    @Override
    @Nonnull
    public PrintJob create(@Nonnull PrintJob job) {
        Objects.requireNonNull(job, "job");
        String id = idGenerator.next();
        while (jobs.containsKey(id)) {
            id = idGenerator.next();
        }
        job.setId(id);
        job.setCreatedAt(clock.instant());
        jobs.put(id, new StoredJob(sequence.incrementAndGet(), job.copy()));
        return job;
    }

    @Override
    public void save(@Nonnull PrintJob job) {
        Objects.requireNonNull(job, "job");
        if (job.getId() == null) {
            throw new StoreException("Cannot save a job that was never created");
        }
        StoredJob updated = jobs.computeIfPresent(job.getId(),
            (id, stored) -> new StoredJob(stored.sequence, job.copy()));
        if (updated == null) {
            throw new StoreException("Unknown print job: " + job.getId());
        }
    }

    @Override
    @Nonnull
    public Optional<PrintJob> findById(@Nonnull String id) {
        StoredJob stored = jobs.get(id);
        return stored != null ? Optional.of(stored.job.copy()) : Optional.empty();
    }

    @Override
    @Nonnull
    public List<PrintJob> findRecent(@Nullable String userId, int limit) {
        return jobs.values().stream()
            .filter(stored -> userId == null || userId.equals(stored.job.getUserId()))
            .sorted(Comparator.comparingLong((StoredJob stored) -> stored.sequence).reversed())
            .limit(Math.max(limit, 0))
            .map(stored -> stored.job.copy())
            .collect(Collectors.toList());
    }

    @Override
    public long countByStatus(@Nonnull Set<JobStatus> statuses) {
        return jobs.values().stream()
            .filter(stored -> statuses.contains(stored.job.getStatus()))
            .count();
    }

    // ==================== Users ====================

    @Override
    @Nonnull
    public Optional<User> findByUsername(@Nonnull String username) {
        return Optional.ofNullable(usersByName.get(username));
    }

    public void addUser(@Nonnull User user) {
        Objects.requireNonNull(user.getId(), "user id");
        Objects.requireNonNull(user.getUsername(), "username");
        usersByName.put(user.getUsername(), user);
    }

    // ==================== IP Registrations ====================

    @Override
    @Nonnull
    public Optional<IpRegistration> findUsable(@Nonnull String ipAddress, @Nonnull Instant now) {
        IpRegistration registration = registrationsByIp.get(ipAddress);
        if (registration == null || !registration.isUsable(now)) {
            return Optional.empty();
        }
        return Optional.of(registration);
    }

    /**
     * Adds a registration. Addresses are unique; a second registration of the same address
     * is rejected.
     */
    public void addIpRegistration(@Nonnull IpRegistration registration) {
        Objects.requireNonNull(registration.getIpAddress(), "ipAddress");
        IpRegistration previous = registrationsByIp.putIfAbsent(registration.getIpAddress(), registration);
        if (previous != null) {
            throw new StoreException("IP address already registered: " + registration.getIpAddress());
        }
    }

    // ==================== IPP Tokens ====================

    @Override
    @Nonnull
    public List<IppToken> findValidByUserId(@Nonnull String userId, @Nonnull Instant now) {
        return tokensById.values().stream()
            .filter(token -> userId.equals(token.getUserId()))
            .filter(token -> token.isValid(now))
            .collect(Collectors.toList());
    }

    @Override
    public void save(@Nonnull IppToken token) {
        Objects.requireNonNull(token.getId(), "token id");
        tokensById.put(token.getId(), token);
    }

    // ==================== Seeding ====================

    /**
     * Loads users, registrations and tokens from a seed document.
     *
     * @param realm the digest realm, used to derive HA1 values from plaintext passwords
     */
    public void seed(@Nonnull StoreSeed seed, @Nonnull String realm) {
        for (StoreSeed.UserEntry entry : seed.getUsers()) {
            addUser(entry.toUser(realm));
        }
        for (StoreSeed.IpEntry entry : seed.getIpRegistrations()) {
            addIpRegistration(entry.toRegistration(idGenerator.next()));
        }
        for (StoreSeed.TokenEntry entry : seed.getTokens()) {
            save(entry.toToken(idGenerator.next()));
        }
        LOGGER.info("Seeded store with {} users, {} IP registrations, {} tokens",
            seed.getUsers().size(), seed.getIpRegistrations().size(), seed.getTokens().size());
    }

    private static final class StoredJob {
        private final long sequence;
        private final PrintJob job;

        StoredJob(long sequence, PrintJob job) {
            this.sequence = sequence;
            this.job = job;
        }
    }
}
