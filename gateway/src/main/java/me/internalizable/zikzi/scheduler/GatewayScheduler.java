package me.internalizable.zikzi.scheduler;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs the gateway's housekeeping tasks (nonce sweeps and the like) on a small pool of
 * daemon threads.
 *
 * <p>Each task carries the name of its owner so errors are logged with the component that
 * scheduled the failing task. Shutdown cancels every task still registered.</p>
 */
public class GatewayScheduler {

    private static final Logger LOGGER = LoggerFactory.getLogger(GatewayScheduler.class);

    private final ScheduledExecutorService executor;
    private final Set<GatewayTask> tasks = ConcurrentHashMap.newKeySet();

    public GatewayScheduler() {
        this(Executors.newScheduledThreadPool(1, new ThreadFactoryBuilder()
            .setNameFormat("Zikzi-Scheduler-%d")
            .setDaemon(true)
            .build()));
    }

    public GatewayScheduler(@Nonnull ScheduledExecutorService executor) {
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Runs a task at a fixed rate until it is cancelled or the scheduler shuts down.
     * An exception thrown by one run is logged and does not stop later runs.
     */
    @Nonnull
    public ScheduledTask runRepeating(@Nonnull String owner, @Nonnull Runnable task,
                                      long initialDelay, long period, @Nonnull TimeUnit unit) {
        if (period <= 0) {
            throw new IllegalArgumentException("period must be positive: " + period);
        }
        Objects.requireNonNull(owner, "owner");
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(unit, "unit");

        GatewayTask scheduledTask = new GatewayTask();
        Runnable wrapper = () -> {
            if (scheduledTask.isCancelled()) {
                return;
            }
            try {
                task.run();
            } catch (Exception e) {
                LOGGER.error("Error executing scheduled task for {}", owner, e);
            }
        };

        scheduledTask.setFuture(executor.scheduleAtFixedRate(wrapper, initialDelay, period, unit));
        tasks.add(scheduledTask);
        return scheduledTask;
    }

    /**
     * Shutdown the scheduler.
     */
    public void shutdown() {
        for (GatewayTask task : tasks) {
            task.cancel();
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private final class GatewayTask implements ScheduledTask {

        private volatile ScheduledFuture<?> future;
        private volatile boolean cancelled;

        void setFuture(ScheduledFuture<?> future) {
            this.future = future;
            if (cancelled) {
                future.cancel(false);
            }
        }

        @Override
        public void cancel() {
            cancelled = true;
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
            tasks.remove(this);
        }

        boolean isCancelled() {
            return cancelled;
        }
    }
}
