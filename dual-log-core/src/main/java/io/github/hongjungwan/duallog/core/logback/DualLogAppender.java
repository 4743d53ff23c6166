package io.github.hongjungwan.duallog.core.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.UnsynchronizedAppenderBase;
import io.github.hongjungwan.duallog.api.LogPipeline;
import io.github.hongjungwan.duallog.api.domain.LogLevel;
import io.github.hongjungwan.duallog.api.redaction.RedactableMessage;
import io.github.hongjungwan.duallog.core.internal.Slf4jConsoleSink;

import java.util.Map;
import java.util.TreeMap;

/**
 * 일반 SLF4J 로그를 파이프라인으로 보내는 Logback Appender.
 *
 * <p>메시지는 마킹되지 않은 텍스트이므로 파일 채널에서는 자동 스캔만 적용된다.
 * 파이프라인 내부 로거와 콘솔 싱크 로거는 순환을 막기 위해 무시한다.</p>
 */
public class DualLogAppender extends UnsynchronizedAppenderBase<ILoggingEvent> {

    static final String INTERNAL_LOGGER_PREFIX = "io.github.hongjungwan.duallog";

    private LogPipeline pipeline;
    private boolean includeCallerData = false;

    public DualLogAppender() {
    }

    public DualLogAppender(LogPipeline pipeline) {
        this.pipeline = pipeline;
    }

    public void setPipeline(LogPipeline pipeline) {
        this.pipeline = pipeline;
    }

    /** 호출 라인 번호 기록 여부. 켜면 Logback 이 호출 위치를 계산하므로 비용이 크다. */
    public void setIncludeCallerData(boolean includeCallerData) {
        this.includeCallerData = includeCallerData;
    }

    @Override
    public void start() {
        if (pipeline == null) {
            addError("No LogPipeline set for appender named [" + name + "]");
            return;
        }
        super.start();
    }

    @Override
    protected void append(ILoggingEvent event) {
        String loggerName = event.getLoggerName();
        if (loggerName != null && (loggerName.startsWith(INTERNAL_LOGGER_PREFIX)
                || loggerName.equals(Slf4jConsoleSink.LOGGER_NAME))) {
            return;
        }

        LogLevel level = toLogLevel(event.getLevel());
        String message = withThrowable(event.getFormattedMessage(), event.getThrowableProxy());

        pipeline.log(level, RedactableMessage.of(message), simpleName(loggerName),
                resolveLineNumber(event), toMetadata(event.getMDCPropertyMap()), false);
    }

    static LogLevel toLogLevel(Level level) {
        return switch (level.toInt()) {
            case Level.ERROR_INT -> LogLevel.ERROR;
            case Level.WARN_INT -> LogLevel.WARNING;
            case Level.INFO_INT -> LogLevel.INFO;
            default -> LogLevel.DEBUG;
        };
    }

    static String simpleName(String loggerName) {
        if (loggerName == null || loggerName.isEmpty()) {
            return "root";
        }
        int lastDot = loggerName.lastIndexOf('.');
        return lastDot < 0 ? loggerName : loggerName.substring(lastDot + 1);
    }

    private Integer resolveLineNumber(ILoggingEvent event) {
        if (!includeCallerData) {
            return null;
        }
        StackTraceElement[] callerData = event.getCallerData();
        if (callerData == null || callerData.length == 0 || callerData[0].getLineNumber() < 0) {
            return null;
        }
        return callerData[0].getLineNumber();
    }

    private static String withThrowable(String message, IThrowableProxy throwable) {
        if (throwable == null) {
            return message;
        }
        String detail = throwable.getMessage() == null
                ? throwable.getClassName()
                : throwable.getClassName() + ": " + throwable.getMessage();
        return message + " (" + detail + ")";
    }

    private static Map<String, String> toMetadata(Map<String, String> mdc) {
        if (mdc == null || mdc.isEmpty()) {
            return Map.of();
        }
        return new TreeMap<>(mdc);
    }
}
