package me.internalizable.zikzi.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class JobFilesTest {

    @TempDir
    Path tempDir;

    @Test
    void namesFileAfterJobAndReceiveTime() throws Exception {
        JobFiles jobFiles = new JobFiles(tempDir.resolve("jobs"), ZoneOffset.UTC);

        Path file = jobFiles.originalFile("0123456789ab", Instant.parse("2024-03-01T09:05:07Z"), ".ps");

        assertThat(file).isEqualTo(tempDir.resolve("jobs").resolve("0123456789ab_20240301_090507.ps"));
        assertThat(Files.isDirectory(tempDir.resolve("jobs"))).isTrue();
    }
}
