package me.internalizable.zikzi.scheduler;

/**
 * Handle to a task registered with the {@link GatewayScheduler}.
 */
public interface ScheduledTask {

    /**
     * Cancels this task. A run already in progress is allowed to finish.
     */
    void cancel();
}
