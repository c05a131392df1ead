package me.internalizable.zikzi.raw;

import me.internalizable.zikzi.api.store.IpRegistrationRepository;
import me.internalizable.zikzi.api.store.PrintJobRepository;
import me.internalizable.zikzi.conversion.ConversionDispatcher;
import me.internalizable.zikzi.store.JobFiles;

import javax.annotation.Nonnull;
import java.time.Clock;
import java.util.Objects;

/**
 * Collaborators shared by all connections of the raw listener.
 */
public final class RawIntake {

    private final PrintJobRepository jobs;
    private final IpRegistrationRepository ipRegistrations;
    private final ConversionDispatcher conversions;
    private final JobFiles jobFiles;
    private final Clock clock;
    private final boolean allowUnregisteredIps;

    public RawIntake(@Nonnull PrintJobRepository jobs,
                     @Nonnull IpRegistrationRepository ipRegistrations,
                     @Nonnull ConversionDispatcher conversions,
                     @Nonnull JobFiles jobFiles,
                     @Nonnull Clock clock,
                     boolean allowUnregisteredIps) {
        this.jobs = Objects.requireNonNull(jobs, "jobs");
        this.ipRegistrations = Objects.requireNonNull(ipRegistrations, "ipRegistrations");
        this.conversions = Objects.requireNonNull(conversions, "conversions");
        this.jobFiles = Objects.requireNonNull(jobFiles, "jobFiles");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.allowUnregisteredIps = allowUnregisteredIps;
    }

    public PrintJobRepository getJobs() { return jobs; }
    public IpRegistrationRepository getIpRegistrations() { return ipRegistrations; }
    public ConversionDispatcher getConversions() { return conversions; }
    public JobFiles getJobFiles() { return jobFiles; }
    public Clock getClock() { return clock; }
    public boolean isAllowUnregisteredIps() { return allowUnregisteredIps; }
}
