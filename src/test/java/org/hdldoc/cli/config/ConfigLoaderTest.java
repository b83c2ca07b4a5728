package org.hdldoc.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link ConfigLoader} precedence rules.
 */
public class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @Tag("unit")
    void classpathDefaultsApplyWithoutFiles() {
        Config config = ConfigLoader.load(null, tempDir.toFile());

        assertThat(config.getInt("hdldoc.extractor.cache-size")).isEqualTo(64);
        assertThat(config.getStringList("hdldoc.extractor.extensions")).containsExactly(".v", ".vlog");
        assertThat(config.getBoolean("hdldoc.output.pretty-print")).isTrue();
        assertThat(config.getString("logging.default-level")).isEqualTo("WARN");
    }

    /**
     * Verifies that hdldoc.conf in the working directory overrides the defaults key by key.
     */
    @Test
    @Tag("unit")
    void workingDirectoryFileOverridesDefaults() throws Exception {
        // Arrange
        Files.writeString(tempDir.resolve(ConfigLoader.CONFIG_FILE_NAME), "hdldoc.extractor.cache-size = 3\n");

        // Act
        Config config = ConfigLoader.load(null, tempDir.toFile());

        // Assert
        assertThat(config.getInt("hdldoc.extractor.cache-size")).isEqualTo(3);
        assertThat(config.getStringList("hdldoc.extractor.extensions")).containsExactly(".v", ".vlog");
    }

    @Test
    @Tag("unit")
    void explicitFileReplacesWorkingDirectoryFile() throws Exception {
        Files.writeString(tempDir.resolve(ConfigLoader.CONFIG_FILE_NAME), "hdldoc.extractor.cache-size = 3\n");
        Path explicit = Files.writeString(tempDir.resolve("custom.conf"), "hdldoc.output.pretty-print = false\n");

        Config config = ConfigLoader.load(explicit.toFile(), tempDir.toFile());

        assertThat(config.getBoolean("hdldoc.output.pretty-print")).isFalse();
        assertThat(config.getInt("hdldoc.extractor.cache-size")).isEqualTo(64);
    }

    @Test
    @Tag("unit")
    void missingExplicitFileIsRejected() {
        File missing = tempDir.resolve("nope.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.load(missing, tempDir.toFile()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nope.conf");
    }

    @Test
    @Tag("unit")
    void systemPropertiesOverrideFiles() throws Exception {
        Files.writeString(tempDir.resolve(ConfigLoader.CONFIG_FILE_NAME), "hdldoc.extractor.cache-size = 3\n");
        System.setProperty("hdldoc.extractor.cache-size", "7");
        try {
            ConfigFactory.invalidateCaches();
            Config config = ConfigLoader.load(null, tempDir.toFile());

            assertThat(config.getInt("hdldoc.extractor.cache-size")).isEqualTo(7);
        } finally {
            System.clearProperty("hdldoc.extractor.cache-size");
            ConfigFactory.invalidateCaches();
        }
    }
}
