package me.internalizable.zikzi.store;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Naming of stored documents under {@code <storage>/jobs}.
 */
public final class JobFiles {

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path jobsDirectory;
    private final ZoneId zone;

    public JobFiles(@Nonnull Path jobsDirectory, @Nonnull ZoneId zone) {
        this.jobsDirectory = Objects.requireNonNull(jobsDirectory, "jobsDirectory");
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    @Nonnull
    public Path getJobsDirectory() {
        return jobsDirectory;
    }

    /**
     * Returns {@code {jobId}_{yyyyMMdd_HHmmss}{extension}} in the jobs directory, creating
     * the directory when missing.
     *
     * @param extension including the dot, e.g. {@code .ps}
     */
    @Nonnull
    public Path originalFile(@Nonnull String jobId, @Nonnull Instant receivedAt, @Nonnull String extension)
            throws IOException {
        Files.createDirectories(jobsDirectory);
        return jobsDirectory.resolve(jobId + "_" + STAMP.format(receivedAt.atZone(zone)) + extension);
    }
}
