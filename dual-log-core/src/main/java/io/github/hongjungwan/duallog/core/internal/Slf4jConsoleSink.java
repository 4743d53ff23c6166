package io.github.hongjungwan.duallog.core.internal;

import io.github.hongjungwan.duallog.api.domain.LogLevel;
import io.github.hongjungwan.duallog.spi.ConsoleSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;
import org.slf4j.spi.LoggingEventBuilder;

/**
 * SLF4J 로거 {@code dual-log.console} 로 콘솔 텍스트를 전달하는 기본 싱크.
 * severity 는 {@link LogLevel#getConsoleLevel()} 을 따르고, CRITICAL 은 {@code CRITICAL} 마커를 붙인다.
 */
public class Slf4jConsoleSink implements ConsoleSink {

    public static final String LOGGER_NAME = "dual-log.console";

    static final Marker CRITICAL_MARKER = MarkerFactory.getMarker("CRITICAL");

    private final Logger logger;

    public Slf4jConsoleSink() {
        this(LoggerFactory.getLogger(LOGGER_NAME));
    }

    Slf4jConsoleSink(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void accept(LogLevel level, String renderedText) {
        LoggingEventBuilder builder = logger.atLevel(level.getConsoleLevel());
        if (level == LogLevel.CRITICAL) {
            builder = builder.addMarker(CRITICAL_MARKER);
        }
        builder.log(renderedText);
    }
}
