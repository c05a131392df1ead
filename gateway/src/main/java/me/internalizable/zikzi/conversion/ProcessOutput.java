package me.internalizable.zikzi.conversion;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Exit status and combined output of a finished process.
 */
public final class ProcessOutput {

    private final int exitCode;
    private final String output;
    private final boolean timedOut;

    public ProcessOutput(int exitCode, @Nonnull String output, boolean timedOut) {
        this.exitCode = exitCode;
        this.output = Objects.requireNonNull(output, "output");
        this.timedOut = timedOut;
    }

    public static ProcessOutput exited(int exitCode, @Nonnull String output) {
        return new ProcessOutput(exitCode, output, false);
    }

    public static ProcessOutput killed(@Nonnull String output) {
        return new ProcessOutput(-1, output, true);
    }

    public int getExitCode() {
        return exitCode;
    }

    @Nonnull
    public String getOutput() {
        return output;
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    public boolean isSuccess() {
        return !timedOut && exitCode == 0;
    }
}
