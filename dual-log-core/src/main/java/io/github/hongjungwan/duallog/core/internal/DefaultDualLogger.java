package io.github.hongjungwan.duallog.core.internal;

import io.github.hongjungwan.duallog.api.DualLogger;
import io.github.hongjungwan.duallog.api.LogPipeline;
import io.github.hongjungwan.duallog.api.domain.LogLevel;
import io.github.hongjungwan.duallog.api.redaction.RedactableMessage;

import java.util.Map;

/**
 * 파이프라인에 위임하는 DualLogger 구현. 호출자 식별자만 보관한다.
 */
public class DefaultDualLogger implements DualLogger {

    private final String name;
    private final LogPipeline pipeline;

    public DefaultDualLogger(String name, LogPipeline pipeline) {
        this.name = name;
        this.pipeline = pipeline;
    }

    @Override
    public void debug(String message) {
        emit(LogLevel.DEBUG, RedactableMessage.of(message), null, false);
    }

    @Override
    public void debug(String message, Map<String, ?> metadata) {
        emit(LogLevel.DEBUG, RedactableMessage.of(message), metadata, false);
    }

    @Override
    public void debug(RedactableMessage message) {
        emit(LogLevel.DEBUG, message, null, false);
    }

    @Override
    public void debug(RedactableMessage message, Map<String, ?> metadata) {
        emit(LogLevel.DEBUG, message, metadata, false);
    }

    @Override
    public void info(String message) {
        emit(LogLevel.INFO, RedactableMessage.of(message), null, false);
    }

    @Override
    public void info(String message, Map<String, ?> metadata) {
        emit(LogLevel.INFO, RedactableMessage.of(message), metadata, false);
    }

    @Override
    public void info(RedactableMessage message) {
        emit(LogLevel.INFO, message, null, false);
    }

    @Override
    public void info(RedactableMessage message, Map<String, ?> metadata) {
        emit(LogLevel.INFO, message, metadata, false);
    }

    @Override
    public void warning(String message) {
        emit(LogLevel.WARNING, RedactableMessage.of(message), null, false);
    }

    @Override
    public void warning(String message, Map<String, ?> metadata) {
        emit(LogLevel.WARNING, RedactableMessage.of(message), metadata, false);
    }

    @Override
    public void warning(RedactableMessage message) {
        emit(LogLevel.WARNING, message, null, false);
    }

    @Override
    public void warning(RedactableMessage message, Map<String, ?> metadata) {
        emit(LogLevel.WARNING, message, metadata, false);
    }

    @Override
    public void error(String message) {
        emit(LogLevel.ERROR, RedactableMessage.of(message), null, false);
    }

    @Override
    public void error(String message, Map<String, ?> metadata) {
        emit(LogLevel.ERROR, RedactableMessage.of(message), metadata, false);
    }

    @Override
    public void error(RedactableMessage message) {
        emit(LogLevel.ERROR, message, null, false);
    }

    @Override
    public void error(RedactableMessage message, Map<String, ?> metadata) {
        emit(LogLevel.ERROR, message, metadata, false);
    }

    @Override
    public void error(String message, boolean includeStackTrace) {
        emit(LogLevel.ERROR, RedactableMessage.of(message), null, includeStackTrace);
    }

    @Override
    public void error(RedactableMessage message, Map<String, ?> metadata, boolean includeStackTrace) {
        emit(LogLevel.ERROR, message, metadata, includeStackTrace);
    }

    @Override
    public void critical(String message) {
        emit(LogLevel.CRITICAL, RedactableMessage.of(message), null, true);
    }

    @Override
    public void critical(String message, Map<String, ?> metadata) {
        emit(LogLevel.CRITICAL, RedactableMessage.of(message), metadata, true);
    }

    @Override
    public void critical(RedactableMessage message) {
        emit(LogLevel.CRITICAL, message, null, true);
    }

    @Override
    public void critical(RedactableMessage message, Map<String, ?> metadata) {
        emit(LogLevel.CRITICAL, message, metadata, true);
    }

    @Override
    public void critical(String message, boolean includeStackTrace) {
        emit(LogLevel.CRITICAL, RedactableMessage.of(message), null, includeStackTrace);
    }

    @Override
    public void critical(RedactableMessage message, Map<String, ?> metadata, boolean includeStackTrace) {
        emit(LogLevel.CRITICAL, message, metadata, includeStackTrace);
    }

    @Override
    public void log(LogLevel level, RedactableMessage message, Map<String, ?> metadata,
                    Integer lineNumber, boolean includeStackTrace) {
        pipeline.log(level, message, name, lineNumber, metadata, includeStackTrace);
    }

    @Override
    public boolean isEnabled(LogLevel level) {
        return level != null && level.isAtLeast(pipeline.getMinimumLevel());
    }

    @Override
    public String getName() {
        return name;
    }

    private void emit(LogLevel level, RedactableMessage message, Map<String, ?> metadata, boolean includeStackTrace) {
        pipeline.log(level, message, name, null, metadata, includeStackTrace);
    }
}
