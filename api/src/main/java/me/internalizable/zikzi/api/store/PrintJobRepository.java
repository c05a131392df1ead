package me.internalizable.zikzi.api.store;

import me.internalizable.zikzi.api.model.JobStatus;
import me.internalizable.zikzi.api.model.PrintJob;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence boundary for print jobs.
 *
 * <p>Implementations serialize their own writes; callers add no locking. Every method
 * may throw {@link StoreException}.</p>
 */
public interface PrintJobRepository {

    /**
     * Inserts a new job, assigning its id and creation time.
     *
     * @param job the job to insert, its id is overwritten
     * @return the same instance, now carrying its persistent id
     */
    @Nonnull
    PrintJob create(@Nonnull PrintJob job);

    /**
     * Writes back all fields of an existing job.
     */
    void save(@Nonnull PrintJob job);

    @Nonnull
    Optional<PrintJob> findById(@Nonnull String id);

    /**
     * Returns the most recently created jobs, newest first.
     *
     * @param userId restricts the result to one user's jobs, or null for all jobs
     * @param limit  maximum number of jobs returned
     */
    @Nonnull
    List<PrintJob> findRecent(@Nullable String userId, int limit);

    long countByStatus(@Nonnull Set<JobStatus> statuses);
}
