package me.internalizable.zikzi.conversion;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import me.internalizable.zikzi.api.model.JobStatus;
import me.internalizable.zikzi.api.model.PrintJob;
import me.internalizable.zikzi.api.store.PrintJobRepository;
import me.internalizable.zikzi.api.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs conversions off the network threads and records their outcome on the job.
 *
 * <p>The queue is unbounded so intake never waits for a conversion. Pending conversions
 * are abandoned on shutdown; their jobs stay in {@link JobStatus#PROCESSING}.</p>
 */
public class ConversionDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConversionDispatcher.class);

    private final ConversionPipeline pipeline;
    private final PrintJobRepository jobs;
    private final Path outputDir;
    private final Clock clock;
    private final ExecutorService executor;

    public ConversionDispatcher(@Nonnull ConversionPipeline pipeline, @Nonnull PrintJobRepository jobs,
                                @Nonnull Path outputDir, @Nonnull Clock clock, int threads) {
        this(pipeline, jobs, outputDir, clock, Executors.newFixedThreadPool(
            threads > 0 ? threads : Runtime.getRuntime().availableProcessors(),
            new ThreadFactoryBuilder()
                .setNameFormat("Zikzi-Conversion-%d")
                .setDaemon(true)
                .build()));
    }

    public ConversionDispatcher(@Nonnull ConversionPipeline pipeline, @Nonnull PrintJobRepository jobs,
                                @Nonnull Path outputDir, @Nonnull Clock clock, @Nonnull ExecutorService executor) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.jobs = Objects.requireNonNull(jobs, "jobs");
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Queues a job for conversion. The job must be in {@link JobStatus#PROCESSING} with its
     * original file set, and must not be modified by the caller afterwards.
     *
     * @throws RejectedExecutionException after {@link #shutdown()}; the job is then saved as
     *                                    {@link JobStatus#FAILED}
     */
    @Nonnull
    public Future<?> dispatch(@Nonnull PrintJob job) {
        Objects.requireNonNull(job, "job");
        if (job.getStatus() != JobStatus.PROCESSING) {
            throw new IllegalStateException("Job " + job.getId() + " is " + job.getStatus() + ", not processing");
        }
        try {
            return executor.submit(() -> process(job));
        } catch (RejectedExecutionException e) {
            LOGGER.warn("Conversion of job {} rejected, dispatcher is shut down", job.getId());
            job.markFailed("conversion not queued", clock.instant());
            save(job);
            throw e;
        }
    }

    /**
     * Converts the job synchronously and saves the outcome.
     */
    void process(PrintJob job) {
        ConversionResult result;
        try {
            result = pipeline.run(Paths.get(job.getOriginalFile()), outputDir, job.getId());
        } catch (RuntimeException e) {
            LOGGER.error("Unexpected error converting job {}", job.getId(), e);
            result = ConversionResult.failed("conversion error: " + e.getMessage());
        }

        Instant now = clock.instant();
        if (result.hasPdf()) {
            if (result.getError() != null) {
                LOGGER.warn("Print job {}: {}", job.getId(), result.getError());
            }
            job.markCompleted(result.getPdfPath(), result.getThumbnailPath(), result.getPageCount(), now);
            LOGGER.info("Print job {} completed: {} pages", job.getId(), result.getPageCount());
        } else {
            job.markFailed(result.getError() != null ? result.getError() : "conversion failed", now);
            LOGGER.error("Print job {} failed: {}", job.getId(), job.getError());
        }

        save(job);
    }

    private void save(PrintJob job) {
        try {
            jobs.save(job);
        } catch (StoreException e) {
            LOGGER.error("Failed to save conversion result of job {}", job.getId(), e);
        }
    }

    /**
     * Stops taking work. Queued and running conversions are not waited for; they continue on
     * daemon threads until the JVM exits.
     */
    public void shutdown() {
        executor.shutdown();
        if (!executor.isTerminated()) {
            LOGGER.info("Conversions still running at shutdown will not be awaited");
        }
    }
}
