package org.tamodel.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import org.tamodel.junit.extensions.logging.AllowLog;
import org.tamodel.junit.extensions.logging.LogLevel;
import org.tamodel.junit.extensions.logging.LogWatchExtension;
import org.tamodel.lsc.EventKind;
import org.tamodel.lsc.EventPrecedence;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for loading {@link ModelSettings} through {@link ConfigLoader} and for
 * applying logging levels with {@link LoggingConfigurator}.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ModelSettingsTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
        LoggingConfigurator.reset();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("tamodel.diagnostics.log-reports");
        ConfigFactory.invalidateCaches();
        LoggingConfigurator.reset();
    }

    @Test
    @DisplayName("The defaults come from reference.conf")
    void defaults() {
        // Act
        ModelSettings settings = ModelSettings.defaults();

        // Assert
        assertThat(settings.eventPrecedence()).isEqualTo(EventPrecedence.DEFAULT);
        assertThat(settings.logReports()).isTrue();
        assertThat(settings.locale()).isEqualTo(Locale.ENGLISH);
    }

    @Test
    @AllowLog(level = LogLevel.INFO, messagePattern = "Loading configuration from file: .*")
    @DisplayName("A configuration file overrides the defaults")
    void fileOverridesDefaults() throws IOException {
        // Arrange
        File file = tempDir.resolve("tamodel.conf").toFile();
        Files.writeString(file.toPath(), "tamodel.lsc.event-precedence = [update, message, condition]\n");

        // Act
        ModelSettings settings = ModelSettings.fromConfig(ConfigLoader.load(file));

        // Assert
        assertThat(settings.eventPrecedence().getOrder())
                .containsExactly(EventKind.UPDATE, EventKind.MESSAGE, EventKind.CONDITION);
        assertThat(settings.logReports()).isTrue();
    }

    @Test
    @DisplayName("System properties override the configuration file")
    void systemPropertiesOverrideFile() {
        // Arrange
        System.setProperty("tamodel.diagnostics.log-reports", "false");
        ConfigFactory.invalidateCaches();

        // Act
        ModelSettings settings = ModelSettings.fromConfig(ConfigLoader.load(tempDir.resolve("missing.conf").toFile()));

        // Assert
        assertThat(settings.logReports()).isFalse();
    }

    @Test
    @DisplayName("An event precedence that is not a permutation is rejected")
    void invalidPrecedence() {
        Config config = ConfigFactory.parseString("tamodel.lsc.event-precedence = [MESSAGE, MESSAGE]")
                .withFallback(ConfigFactory.parseResources("reference.conf")).resolve();
        assertThatThrownBy(() -> ModelSettings.fromConfig(config)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ModelSettings.fromConfig(ConfigFactory.empty())).isInstanceOf(ConfigException.class);
    }

    @Test
    @DisplayName("Logging levels are applied once per reset")
    void loggingConfiguratorAppliesLevels() {
        // Arrange
        Config config = ConfigFactory.parseString(
                "logging { default-level = \"INFO\", levels { \"org.tamodel.lsc\" = \"DEBUG\" } }");
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Level rootBefore = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).getLevel();

        try {
            // Act
            int configured = LoggingConfigurator.configure(config);
            int again = LoggingConfigurator.configure(config);

            // Assert
            assertThat(configured).isEqualTo(1);
            assertThat(again).isZero();
            assertThat(context.getLogger("org.tamodel.lsc").getLevel()).isEqualTo(Level.DEBUG);
        } finally {
            context.getLogger("org.tamodel.lsc").setLevel(null);
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(rootBefore);
        }
    }
}
