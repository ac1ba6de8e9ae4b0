package dev.abapfmt.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.OutputStreamAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import dev.abapfmt.config.LogFormat;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

    @AfterEach
    void restoreTextLogging() {
        LoggingConfigurator.configure(LogFormat.TEXT, false);
    }

    @Test
    void switchesEncoderAndLevel() {
        LoggingConfigurator.configure(LogFormat.JSON, true);

        Logger root = rootLogger();
        OutputStreamAppender<ILoggingEvent> appender = (OutputStreamAppender<ILoggingEvent>) root.getAppender("STDERR");
        assertThat(root.getLevel()).isEqualTo(Level.DEBUG);
        assertThat(appender.getEncoder()).isInstanceOf(LayoutWrappingEncoder.class);
        assertThat(((LayoutWrappingEncoder<ILoggingEvent>) appender.getEncoder()).getLayout())
                .isInstanceOf(SimpleJsonLayout.class);

        LoggingConfigurator.configure(LogFormat.TEXT, false);

        assertThat(root.getLevel()).isEqualTo(Level.INFO);
        assertThat(appender.getEncoder()).isInstanceOf(PatternLayoutEncoder.class);
        assertThat(appender.isStarted()).isTrue();
    }

    private static Logger rootLogger() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        return context.getLogger(Logger.ROOT_LOGGER_NAME);
    }
}
