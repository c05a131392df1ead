package me.internalizable.zikzi.api.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.time.Instant;
import java.util.Objects;

/**
 * A document submitted through one of the intake protocols.
 *
 * <p>The descriptive fields (document name, hostname, application, ...) are plain
 * properties. The lifecycle fields are only changed through the transition methods,
 * which enforce the forward-only {@link JobStatus} order:</p>
 * <ul>
 *   <li>{@link #markProcessing(String, long)} once the original document is on disk</li>
 *   <li>{@link #markCompleted(String, String, int, Instant)} when a PDF was produced</li>
 *   <li>{@link #markFailed(String, Instant)} when the document could not be stored or converted</li>
 * </ul>
 *
 * <p>Instances are not thread-safe. A job is owned by one intake handler until it is
 * handed to the conversion pipeline, which then owns it until the terminal transition.</p>
 */
public class PrintJob {

    private String id;
    private Instant createdAt;

    // Empty or null means the job is orphaned (no attributable user)
    private String userId;

    private String sourceIp;
    private String hostname;
    private String documentName;
    private String appName;
    private String osVersion;

    private String originalFile;
    private String pdfFile;
    private String thumbnailFile;

    private int pageCount;
    private long fileSize;
    private JobStatus status = JobStatus.RECEIVED;

    private Instant processedAt;
    private String error;

    public PrintJob() {
    }

    public PrintJob(@Nullable String userId, @Nonnull String sourceIp) {
        this.userId = userId;
        this.sourceIp = Objects.requireNonNull(sourceIp, "sourceIp");
    }

    // ==================== Transitions ====================

    /**
     * Records the stored original document and moves the job to PROCESSING.
     *
     * @throws IllegalStateException if the job is not RECEIVED
     */
    public void markProcessing(@Nonnull String originalFile, long fileSize) {
        advance(JobStatus.PROCESSING);
        this.originalFile = Objects.requireNonNull(originalFile, "originalFile");
        this.fileSize = fileSize;
    }

    /**
     * Moves the job to COMPLETED.
     *
     * @param pdfFile       the produced PDF, never empty
     * @param thumbnailFile the thumbnail, may be empty when rendering failed
     * @param pageCount     the page count, at least 1
     * @param processedAt   completion time
     * @throws IllegalStateException if the job is not PROCESSING
     */
    public void markCompleted(@Nonnull String pdfFile, @Nullable String thumbnailFile,
                              int pageCount, @Nonnull Instant processedAt) {
        if (pdfFile == null || pdfFile.isEmpty()) {
            throw new IllegalArgumentException("A completed job needs a PDF file");
        }
        if (pageCount < 1) {
            throw new IllegalArgumentException("A completed job needs at least one page, got " + pageCount);
        }
        advance(JobStatus.COMPLETED);
        this.pdfFile = pdfFile;
        this.thumbnailFile = thumbnailFile != null ? thumbnailFile : "";
        this.pageCount = pageCount;
        this.processedAt = Objects.requireNonNull(processedAt, "processedAt");
    }

    /**
     * Moves the job to FAILED.
     *
     * @throws IllegalStateException if the job already reached a terminal state
     */
    public void markFailed(@Nonnull String error, @Nonnull Instant processedAt) {
        advance(JobStatus.FAILED);
        this.error = Objects.requireNonNull(error, "error");
        this.processedAt = Objects.requireNonNull(processedAt, "processedAt");
    }

    private void advance(JobStatus next) {
        if (!status.canAdvanceTo(next)) {
            throw new IllegalStateException("Job " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }

    public boolean isOrphaned() {
        return userId == null || userId.isEmpty();
    }

    /**
     * Returns a detached copy, used by stores that must not share instances with callers.
     */
    @Nonnull
    public PrintJob copy() {
        PrintJob copy = new PrintJob();
        copy.id = id;
        copy.createdAt = createdAt;
        copy.userId = userId;
        copy.sourceIp = sourceIp;
        copy.hostname = hostname;
        copy.documentName = documentName;
        copy.appName = appName;
        copy.osVersion = osVersion;
        copy.originalFile = originalFile;
        copy.pdfFile = pdfFile;
        copy.thumbnailFile = thumbnailFile;
        copy.pageCount = pageCount;
        copy.fileSize = fileSize;
        copy.status = status;
        copy.processedAt = processedAt;
        copy.error = error;
        return copy;
    }

    // ==================== Identity ====================

    @Nullable
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    @Nullable
    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    @Nullable
    public String getUserId() { return userId; }
    public void setUserId(String userId) { this.userId = userId; }

    // ==================== Client Info ====================

    public String getSourceIp() { return sourceIp; }
    public void setSourceIp(String sourceIp) { this.sourceIp = sourceIp; }

    public String getHostname() { return hostname; }
    public void setHostname(String hostname) { this.hostname = hostname; }

    public String getDocumentName() { return documentName; }
    public void setDocumentName(String documentName) { this.documentName = documentName; }

    public String getAppName() { return appName; }
    public void setAppName(String appName) { this.appName = appName; }

    public String getOsVersion() { return osVersion; }
    public void setOsVersion(String osVersion) { this.osVersion = osVersion; }

    // ==================== Files ====================

    public String getOriginalFile() { return originalFile; }
    public String getPdfFile() { return pdfFile; }
    public String getThumbnailFile() { return thumbnailFile; }

    public int getPageCount() { return pageCount; }
    public long getFileSize() { return fileSize; }

    // ==================== Lifecycle ====================

    @Nonnull
    public JobStatus getStatus() { return status; }

    @Nullable
    public Instant getProcessedAt() { return processedAt; }

    @Nullable
    public String getError() { return error; }

    @Override
    public String toString() {
        return "PrintJob{" +
                "id='" + id + '\'' +
                ", userId='" + userId + '\'' +
                ", sourceIp='" + sourceIp + '\'' +
                ", documentName='" + documentName + '\'' +
                ", status=" + status +
                '}';
    }
}
