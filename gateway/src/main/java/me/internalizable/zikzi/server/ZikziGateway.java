package me.internalizable.zikzi.server;

import me.internalizable.zikzi.auth.AuthResolver;
import me.internalizable.zikzi.auth.BCryptPasswordVerifier;
import me.internalizable.zikzi.auth.NonceCache;
import me.internalizable.zikzi.config.GatewayConfig;
import me.internalizable.zikzi.config.IppConfig;
import me.internalizable.zikzi.config.PrinterConfig;
import me.internalizable.zikzi.config.StorageConfig;
import me.internalizable.zikzi.conversion.ConversionDispatcher;
import me.internalizable.zikzi.conversion.ConversionPipeline;
import me.internalizable.zikzi.conversion.ExternalProcessRunner;
import me.internalizable.zikzi.conversion.Ghostscript;
import me.internalizable.zikzi.ipp.IppServer;
import me.internalizable.zikzi.ipp.IppService;
import me.internalizable.zikzi.raw.RawIntake;
import me.internalizable.zikzi.raw.RawSocketServer;
import me.internalizable.zikzi.scheduler.GatewayScheduler;
import me.internalizable.zikzi.store.InMemoryPrintStore;
import me.internalizable.zikzi.store.JobFiles;
import me.internalizable.zikzi.store.StoreSeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * The print intake gateway: the raw PostScript listener, the optional IPP listener and the
 * conversion pipeline behind them.
 *
 * <p>Intake flow:</p>
 * <ul>
 *   <li><b>Raw</b>: one document per TCP connection, attributed through the IP registration
 *       of the (possibly PROXY-announced) client address.</li>
 *   <li><b>IPP</b>: Print-Job over HTTP, attributed through IP registration, Basic or Digest
 *       credentials.</li>
 * </ul>
 *
 * <p>Both paths store the original document and queue it on the shared
 * {@link ConversionDispatcher}, which turns it into a PDF and a thumbnail with Ghostscript.</p>
 */
public class ZikziGateway {

    private static final Logger LOGGER = LoggerFactory.getLogger(ZikziGateway.class);

    private final GatewayConfig config;
    private final Clock clock;
    private final InMemoryPrintStore store;
    private final GatewayScheduler scheduler;
    private final NonceCache nonceCache;
    private final ConversionDispatcher conversions;
    private final RawSocketServer rawServer;
    private final IppServer ippServer;

    private volatile boolean running = false;

    public ZikziGateway(@Nonnull GatewayConfig config) {
        this(config, Clock.systemUTC());
    }

    public ZikziGateway(@Nonnull GatewayConfig config, @Nonnull Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");

        StorageConfig storage = config.getStorage();
        PrinterConfig printer = config.getPrinter();
        IppConfig ipp = config.getIpp();

        this.store = new InMemoryPrintStore(clock);
        this.scheduler = new GatewayScheduler();
        this.nonceCache = new NonceCache(clock, scheduler);

        Path jobsDirectory = storage.getJobsDirectory();
        JobFiles jobFiles = new JobFiles(jobsDirectory, clock.getZone());
        Ghostscript ghostscript = new Ghostscript(storage.getGhostscriptBin(), new ExternalProcessRunner(),
            Duration.ofSeconds(storage.getConversionTimeoutSeconds()));
        this.conversions = new ConversionDispatcher(new ConversionPipeline(ghostscript), store, jobsDirectory,
            clock, storage.getConversionThreads());

        RawIntake intake = new RawIntake(store, store, conversions, jobFiles, clock, printer.isAllowUnregisteredIps());
        this.rawServer = new RawSocketServer(printer, intake, config.isDebugMode());

        if (ipp.isEnabled()) {
            AuthResolver authResolver = new AuthResolver(ipp.getAuth(), store, store, store, nonceCache,
                new BCryptPasswordVerifier(), clock);
            IppService service = new IppService(ipp.getPrinterUri(), ipp.getAuth(),
                printer.isAllowUnregisteredIps(), authResolver, store, jobFiles, conversions, clock);
            this.ippServer = new IppServer(ipp, service);
        } else {
            this.ippServer = null;
        }
    }

    /**
     * Seeds the store and binds the listeners.
     *
     * @throws IOException          if the storage directory or the seed file cannot be used
     * @throws InterruptedException if interrupted while binding
     */
    public void start() throws IOException, InterruptedException {
        if (running) {
            throw new IllegalStateException("Gateway is already running");
        }

        LOGGER.info("Starting Zikzi print gateway...");
        LOGGER.info("Debug mode: {}", config.isDebugMode());

        StorageConfig storage = config.getStorage();
        Files.createDirectories(storage.getJobsDirectory());
        LOGGER.info("Storing documents in {}", storage.getJobsDirectory().toAbsolutePath());

        if (storage.getSeedFile() != null && !storage.getSeedFile().isEmpty()) {
            Path seedFile = Paths.get(storage.getSeedFile());
            store.seed(StoreSeed.load(seedFile), config.getIpp().getAuth().getRealm());
            LOGGER.info("Loaded users, IP registrations and tokens from {}", seedFile);
        }

        if (config.getPrinter().isAllowUnregisteredIps()) {
            LOGGER.warn("Accepting print jobs from unregistered clients, they will be stored as orphaned jobs");
        }

        try {
            rawServer.start();
            if (ippServer != null) {
                ippServer.start();
                LOGGER.info("IPP printer URI: {}", config.getIpp().getPrinterUri());
            } else {
                LOGGER.info("IPP server disabled");
            }
        } catch (InterruptedException | RuntimeException e) {
            stopServers();
            throw e;
        }

        running = true;
        LOGGER.info("Zikzi print gateway started");
    }

    /**
     * Stops both listeners, giving open connections the configured grace period. Running
     * conversions are not awaited.
     */
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        LOGGER.info("Stopping Zikzi print gateway...");

        stopServers();
        conversions.shutdown();
        nonceCache.close();
        scheduler.shutdown();

        LOGGER.info("Zikzi print gateway stopped");
    }

    private void stopServers() {
        long grace = config.getShutdownGraceSeconds();
        rawServer.stop(grace);
        if (ippServer != null) {
            ippServer.stop(grace);
        }
    }

    public boolean isRunning() {
        return running;
    }

    @Nonnull
    public GatewayConfig getConfig() {
        return config;
    }

    @Nonnull
    public InMemoryPrintStore getStore() {
        return store;
    }

    @Nonnull
    public RawSocketServer getRawServer() {
        return rawServer;
    }

    @Nullable
    public IppServer getIppServer() {
        return ippServer;
    }
}
