package me.internalizable.zikzi.api.model;

import javax.annotation.Nonnull;

/**
 * Lifecycle state of a {@link PrintJob}.
 *
 * <p>A job only ever moves forward:</p>
 * <pre>
 * RECEIVED -&gt; PROCESSING -&gt; COMPLETED
 *     \                  \-&gt; FAILED
 *      \-----------------&gt; FAILED
 * </pre>
 *
 * <p>A received job fails directly when its document could not be stored.</p>
 */
public enum JobStatus {

    RECEIVED("received"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String id;

    JobStatus(String id) {
        this.id = id;
    }

    /**
     * Returns the stable lowercase identifier stored with the job.
     */
    @Nonnull
    public String getId() {
        return id;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Whether a job in this state may move to {@code next}.
     *
     * @param next the requested state
     * @return true for RECEIVED to PROCESSING or FAILED, and for PROCESSING to a terminal state
     */
    public boolean canAdvanceTo(@Nonnull JobStatus next) {
        switch (this) {
            case RECEIVED:
                return next == PROCESSING || next == FAILED;
            case PROCESSING:
                return next.isTerminal();
            default:
                return false;
        }
    }
}
