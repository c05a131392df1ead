package me.internalizable.zikzi;

import me.internalizable.zikzi.config.GatewayConfig;
import me.internalizable.zikzi.server.ZikziGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line entry point.
 *
 * <p>Usage: {@code java -jar zikzi-gateway.jar [config-file]}, the configuration defaults to
 * {@code config/zikzi.yml} and is created with default values when missing.</p>
 */
public final class Main {

    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    static final String DEFAULT_CONFIG = "config/zikzi.yml";

    private Main() {
    }

    public static void main(String[] args) {
        Path configPath = Paths.get(args.length > 0 ? args[0] : DEFAULT_CONFIG);

        ZikziGateway gateway;
        try {
            GatewayConfig config = GatewayConfig.load(configPath);
            LOGGER.info("Loaded configuration from {}", configPath.toAbsolutePath());
            gateway = new ZikziGateway(config);
            gateway.start();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.error("Interrupted while starting the gateway");
            System.exit(1);
            return;
        } catch (Exception e) {
            LOGGER.error("Failed to start the gateway", e);
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(gateway::stop, "Zikzi-Shutdown"));
    }
}
