package org.metric.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("metric.cli.color");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @Tag("unit")
    void testDefaultsMatchReferenceConf() {
        // Act
        MetricSettings settings = MetricSettings.from(ConfigLoader.defaults());

        // Assert
        assertThat(settings).isEqualTo(MetricSettings.DEFAULTS);
        assertThat(ConfigLoader.defaults().getString("logging.default-level")).isEqualTo("WARN");
    }

    @Test
    @Tag("unit")
    void testExplicitFileOverridesDefaults() throws IOException {
        // Arrange
        File file = tempDir.resolve("custom.conf").toFile();
        Files.writeString(file.toPath(), "metric.style.enabled = false\nmetric.source-extension = \".mt\"");

        // Act
        MetricSettings settings = MetricSettings.from(ConfigLoader.load(file));

        // Assert
        assertThat(settings.styleEnabled()).isFalse();
        assertThat(settings.sourceExtension()).isEqualTo(".mt");
        assertThat(settings.showTiming()).isTrue();
    }

    /**
     * Verifies that system properties take precedence over the configuration file.
     */
    @Test
    @Tag("unit")
    void testSystemPropertiesOverrideFile() throws IOException {
        File file = tempDir.resolve("custom.conf").toFile();
        Files.writeString(file.toPath(), "metric.cli.color = true");
        System.setProperty("metric.cli.color", "false");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(file);

        assertThat(config.getBoolean("metric.cli.color")).isFalse();
    }

    @Test
    @Tag("unit")
    void testMissingExplicitFileFails() {
        File missing = tempDir.resolve("absent.conf").toFile();

        assertThatThrownBy(() -> ConfigLoader.load(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Configuration file not found: " + missing.getPath());
    }

    @Test
    @Tag("unit")
    void testWithColor() {
        MetricSettings plain = MetricSettings.DEFAULTS.withColor(false);

        assertThat(plain.color()).isFalse();
        assertThat(plain.sourceExtension()).isEqualTo(".metric");
    }
}
