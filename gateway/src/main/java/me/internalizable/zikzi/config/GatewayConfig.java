package me.internalizable.zikzi.config;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.introspector.Property;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;

import java.io.*;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Configuration for the Zikzi print gateway.
 *
 * <p>Loaded once at startup from a YAML file. A missing file is created with the
 * defaults so operators have something to edit.</p>
 */
public class GatewayConfig {

    private PrinterConfig printer = new PrinterConfig();
    private IppConfig ipp = new IppConfig();
    private StorageConfig storage = new StorageConfig();

    // Grace period for open connections when the gateway stops
    private int shutdownGraceSeconds = 5;

    // Debug options
    private boolean debugMode = false;

    public GatewayConfig() {
    }

    // ==================== Load / Save ====================

    public static GatewayConfig load(Path path) throws IOException {
        if (!Files.exists(path)) {
            GatewayConfig config = new GatewayConfig();
            config.save(path);
            return config;
        }

        LoaderOptions options = new LoaderOptions();
        Yaml yaml = new Yaml(new Constructor(GatewayConfig.class, options));
        try (InputStream is = Files.newInputStream(path)) {
            GatewayConfig config = yaml.load(is);
            // An empty document yields null
            return config != null ? config : new GatewayConfig();
        }
    }

    public void save(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        DumperOptions dumperOptions = new DumperOptions();
        dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        dumperOptions.setPrettyFlow(true);
        dumperOptions.setIndent(2);
        dumperOptions.setIndicatorIndent(2);
        dumperOptions.setIndentWithIndicator(true);

        Representer representer = new Representer(dumperOptions) {
            @Override
            protected NodeTuple representJavaBeanProperty(Object javaBean, Property property,
                                                          Object propertyValue, Tag customTag) {
                if (propertyValue == null) {
                    return null;
                }
                return super.representJavaBeanProperty(javaBean, property, propertyValue, customTag);
            }

            @Override
            protected Set<Property> getProperties(Class<?> type) {
                Set<Property> props = super.getProperties(type);
                if (type == GatewayConfig.class) {
                    return orderProperties(props, "printer", "ipp", "storage", "shutdownGraceSeconds", "debugMode");
                }
                if (type == PrinterConfig.class) {
                    return orderProperties(props, "host", "port", "allowUnregisteredIps", "proxyProtocol");
                }
                if (type == IppConfig.class) {
                    return orderProperties(props,
                        "enabled", "host", "port", "externalHostname",
                        "trustProxy", "trustedProxies", "maxRequestBytes", "auth"
                    );
                }
                if (type == StorageConfig.class) {
                    return orderProperties(props,
                        "path", "ghostscriptBin", "conversionTimeoutSeconds", "conversionThreads", "seedFile"
                    );
                }
                return props;
            }

            private Set<Property> orderProperties(Set<Property> props, String... order) {
                Set<Property> ordered = new LinkedHashSet<>();
                for (String name : order) {
                    for (Property p : props) {
                        if (p.getName().equals(name)) {
                            ordered.add(p);
                            break;
                        }
                    }
                }
                for (Property p : props) {
                    if (!ordered.contains(p)) {
                        ordered.add(p);
                    }
                }
                return ordered;
            }
        };

        representer.addClassTag(GatewayConfig.class, Tag.MAP);
        representer.addClassTag(PrinterConfig.class, Tag.MAP);
        representer.addClassTag(ProxyProtocolConfig.class, Tag.MAP);
        representer.addClassTag(IppConfig.class, Tag.MAP);
        representer.addClassTag(IppAuthConfig.class, Tag.MAP);
        representer.addClassTag(StorageConfig.class, Tag.MAP);

        Yaml yaml = new Yaml(representer, dumperOptions);

        try (Writer writer = Files.newBufferedWriter(path)) {
            writer.write("# Zikzi Print Gateway Configuration\n\n");
            yaml.dump(this, writer);
        }
    }

    // ==================== Section Getters/Setters ====================

    public PrinterConfig getPrinter() { return printer; }
    public void setPrinter(PrinterConfig printer) { this.printer = printer != null ? printer : new PrinterConfig(); }

    public IppConfig getIpp() { return ipp; }
    public void setIpp(IppConfig ipp) { this.ipp = ipp != null ? ipp : new IppConfig(); }

    public StorageConfig getStorage() { return storage; }
    public void setStorage(StorageConfig storage) { this.storage = storage != null ? storage : new StorageConfig(); }

    // ==================== Lifecycle Getters/Setters ====================

    public int getShutdownGraceSeconds() { return shutdownGraceSeconds; }
    public void setShutdownGraceSeconds(int shutdownGraceSeconds) { this.shutdownGraceSeconds = shutdownGraceSeconds; }

    // ==================== Debug Getters/Setters ====================

    public boolean isDebugMode() { return debugMode; }
    public void setDebugMode(boolean debugMode) { this.debugMode = debugMode; }
}
