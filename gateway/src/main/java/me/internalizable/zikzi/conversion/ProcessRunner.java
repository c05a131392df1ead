package me.internalizable.zikzi.conversion;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external command to completion.
 */
public interface ProcessRunner {

    /**
     * Runs the command and collects its combined stdout and stderr.
     *
     * @param command the executable followed by its arguments
     * @param timeout how long the process may run before it is killed
     * @return the exit status and output; a killed process reports {@link ProcessOutput#isTimedOut()}
     * @throws IOException if the process could not be started or its output not read
     */
    @Nonnull
    ProcessOutput run(@Nonnull List<String> command, @Nonnull Duration timeout) throws IOException;
}
