package com.heritagesync.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void resolve_relativeLocation_resolvesAgainstBase() {
        Path resolved = FileUtils.resolve(tempDir, "data/../data/sites.json");

        assertThat(resolved).isEqualTo(tempDir.resolve("data/sites.json").toAbsolutePath().normalize());
    }

    @Test
    void resolve_absoluteLocation_ignoresBase() {
        Path absolute = tempDir.resolve("elsewhere/sites.json").toAbsolutePath();

        assertThat(FileUtils.resolve(Path.of("ignored"), absolute.toString())).isEqualTo(absolute.normalize());
    }

    @Test
    void getExtension_returnsLowerCaseExtension() {
        assertThat(FileUtils.getExtension(Path.of("whc-en.XML"))).isEqualTo("xml");
        assertThat(FileUtils.getExtension(Path.of("sites.json"))).isEqualTo("json");
        assertThat(FileUtils.getExtension(Path.of("README"))).isEmpty();
        assertThat(FileUtils.getExtension(Path.of(".hidden"))).isEmpty();
    }

    @Test
    void formatSize_picksUnit() {
        assertThat(FileUtils.formatSize(512)).isEqualTo("512 B");
        assertThat(FileUtils.formatSize(2048)).isEqualTo("2.00 KB");
        assertThat(FileUtils.formatSize(3 * 1024 * 1024)).isEqualTo("3.00 MB");
    }
}
