package me.internalizable.zikzi.conversion;

import com.google.common.io.ByteStreams;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link ProcessRunner} backed by {@link ProcessBuilder}.
 *
 * <p>Output is drained on a thread of the runner's own pool so a chatty process can not
 * block on a full pipe while we wait for it. The pool grows with the number of processes
 * running at once and its idle threads expire.</p>
 */
public final class ExternalProcessRunner implements ProcessRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExternalProcessRunner.class);

    private final ExecutorService drainers = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
        .setNameFormat("Zikzi-ProcessOutput-%d")
        .setDaemon(true)
        .build());

    @Override
    @Nonnull
    public ProcessOutput run(@Nonnull List<String> command, @Nonnull Duration timeout) throws IOException {
        Process process = new ProcessBuilder(command)
            .redirectErrorStream(true)
            .start();
        process.getOutputStream().close();

        CompletableFuture<String> output =
            CompletableFuture.supplyAsync(() -> drain(process.getInputStream()), drainers);
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("{} did not finish within {} s, killing it", command.get(0), timeout.getSeconds());
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
                return ProcessOutput.killed(collect(output));
            }
            return ProcessOutput.exited(process.exitValue(), collect(output));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for " + command.get(0), e);
        }
    }

    private static String drain(InputStream in) {
        try (in) {
            return new String(ByteStreams.toByteArray(in), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read process output", e);
        }
    }

    private static String collect(CompletableFuture<String> output) throws IOException, InterruptedException {
        try {
            return output.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw new IOException("Failed to read process output", e.getCause());
        } catch (TimeoutException e) {
            // Output still open after the process ended: a child inherited the pipe
            LOGGER.debug("Gave up reading process output after exit");
            output.cancel(true);
            return "";
        }
    }
}
