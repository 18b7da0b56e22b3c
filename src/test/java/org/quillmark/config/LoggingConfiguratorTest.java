package org.quillmark.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.quillmark.junit.extensions.logging.ExpectLog;
import org.quillmark.junit.extensions.logging.LogLevel;
import org.quillmark.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.LoggerFactory;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private Level rootLevel;

    @BeforeEach
    void setUp() {
        rootLevel = context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel();
    }

    @AfterEach
    void tearDown() {
        context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        context.getLogger("org.quillmark.css").setLevel(null);
        context.getLogger("org.quillmark.rewrite").setLevel(null);
    }

    @Test
    @DisplayName("Should apply the default level and specific logger levels")
    void configure_shouldApplyLevels() {
        // Arrange
        Config config = ConfigFactory.parseString("""
                logging {
                  default-level = ERROR
                  levels {
                    "org.quillmark.css" = DEBUG
                    org.quillmark.rewrite = INFO
                  }
                }
                """);

        // Act
        LoggingConfigurator.configure(config);

        // Assert
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(Level.ERROR);
        assertThat(context.getLogger("org.quillmark.css").getLevel()).isEqualTo(Level.DEBUG);
        assertThat(context.getLogger("org.quillmark.rewrite").getLevel()).isEqualTo(Level.INFO);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Unknown log level 'LOUD' for logger 'org.quillmark.css'")
    @DisplayName("Unknown levels should be reported and skipped")
    void configure_shouldSkipUnknownLevels() {
        // Arrange
        Config config = ConfigFactory.parseString("logging.levels { \"org.quillmark.css\" = LOUD }");

        // Act
        LoggingConfigurator.configure(config);

        // Assert
        assertThat(context.getLogger("org.quillmark.css").getLevel()).isNull();
    }

    @Test
    @DisplayName("A configuration without logging section should change nothing")
    void configure_shouldIgnoreMissingSection() {
        // Act
        LoggingConfigurator.configure(ConfigFactory.empty());

        // Assert
        assertThat(context.getLogger(Logger.ROOT_LOGGER_NAME).getLevel()).isEqualTo(rootLevel);
    }
}
