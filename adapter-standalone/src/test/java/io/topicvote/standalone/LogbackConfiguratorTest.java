package io.topicvote.standalone;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

@DisplayName("LogbackConfigurator")
class LogbackConfiguratorTest {

    private final Logger root =
            ((LoggerContext) LoggerFactory.getILoggerFactory()).getLogger(Logger.ROOT_LOGGER_NAME);

    @AfterEach
    void restore() {
        LogbackConfigurator.configure("text", "WARN");
    }

    private ConsoleAppender<ILoggingEvent> stderrAppender() {
        return (ConsoleAppender<ILoggingEvent>) root.getAppender("STDERR");
    }

    @Test
    @DisplayName("json format installs the JSON encoder")
    void jsonFormat() {
        LogbackConfigurator.configure("JSON", "DEBUG");

        assertThat(root.getLevel()).isEqualTo(Level.DEBUG);
        assertThat(stderrAppender().getEncoder()).isInstanceOf(JsonEncoder.class);
        assertThat(stderrAppender().getTarget()).isEqualTo("System.err");
    }

    @Test
    @DisplayName("text format uses the pattern with the voting MDC key")
    void textFormat() {
        LogbackConfigurator.configure("text", "ERROR");

        assertThat(root.getLevel()).isEqualTo(Level.ERROR);
        assertThat(stderrAppender().getEncoder()).isInstanceOf(PatternLayoutEncoder.class);
        assertThat(((PatternLayoutEncoder) stderrAppender().getEncoder()).getPattern())
                .isEqualTo(LogbackConfigurator.TEXT_PATTERN)
                .contains("%X{voting}");
    }

    @Test
    @DisplayName("unknown level falls back to INFO and old appenders are replaced")
    void unknownLevel() {
        LogbackConfigurator.configure("text", "LOUD");

        assertThat(root.getLevel()).isEqualTo(Level.INFO);
        assertThat(root.getAppender("CONSOLE")).isNull();
    }
}
