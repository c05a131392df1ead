package me.internalizable.zikzi.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class GatewayConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileIsCreatedWithDefaults() throws Exception {
        // Given
        Path path = tempDir.resolve("config").resolve("zikzi.yml");

        // When
        GatewayConfig config = GatewayConfig.load(path);

        // Then
        assertThat(Files.exists(path)).isTrue();
        assertThat(config.getPrinter().getPort()).isEqualTo(9100);
        assertThat(config.getPrinter().isAllowUnregisteredIps()).isFalse();
        assertThat(config.getPrinter().getProxyProtocol().isEnabled()).isFalse();
        assertThat(config.getIpp().isEnabled()).isTrue();
        assertThat(config.getIpp().getPort()).isEqualTo(631);
        assertThat(config.getIpp().getAuth().getRealm()).isEqualTo("zikzi");
        assertThat(config.getStorage().getGhostscriptBin()).isEqualTo("gs");
        assertThat(config.getShutdownGraceSeconds()).isEqualTo(5);
    }

    @Test
    void savedConfigLoadsBack() throws Exception {
        // Given
        Path path = tempDir.resolve("zikzi.yml");
        GatewayConfig config = new GatewayConfig();
        config.getPrinter().setPort(9200);
        config.getPrinter().getProxyProtocol().setEnabled(true);
        config.getPrinter().getProxyProtocol().getTrustedProxies().add("10.0.0.0/8");
        config.getIpp().setExternalHostname("print.example.com");
        config.getIpp().getAuth().setAllowIp(false);
        config.getStorage().setPath("/var/lib/zikzi");

        // When
        config.save(path);
        GatewayConfig loaded = GatewayConfig.load(path);

        // Then
        assertThat(loaded.getPrinter().getPort()).isEqualTo(9200);
        assertThat(loaded.getPrinter().getProxyProtocol().isEnabled()).isTrue();
        assertThat(loaded.getPrinter().getProxyProtocol().getTrustedProxies()).containsExactly("10.0.0.0/8");
        assertThat(loaded.getIpp().getPrinterUri()).isEqualTo("ipp://print.example.com:631/ipp/print");
        assertThat(loaded.getIpp().getAuth().isAllowIp()).isFalse();
        assertThat(loaded.getStorage().getJobsDirectory().toString()).endsWith("jobs");
        assertThat(new String(Files.readAllBytes(path), StandardCharsets.UTF_8))
            .startsWith("# Zikzi Print Gateway Configuration")
            .doesNotContain("!!");
    }

    @Test
    void partialFileKeepsDefaultsForMissingKeys() throws Exception {
        Path path = tempDir.resolve("zikzi.yml");
        Files.write(path, String.join("\n",
            "printer:",
            "  allowUnregisteredIps: true",
            "ipp:",
            "  enabled: false",
            "").getBytes(StandardCharsets.UTF_8));

        GatewayConfig config = GatewayConfig.load(path);

        assertThat(config.getPrinter().isAllowUnregisteredIps()).isTrue();
        assertThat(config.getPrinter().getPort()).isEqualTo(9100);
        assertThat(config.getIpp().isEnabled()).isFalse();
        assertThat(config.getIpp().getAuth().isAllowLogin()).isTrue();
    }

    @Test
    void printerUriFallsBackToLocalhostForWildcardHost() {
        IppConfig ipp = new IppConfig();

        assertThat(ipp.getPrinterUri()).isEqualTo("ipp://localhost:631/ipp/print");
    }
}
