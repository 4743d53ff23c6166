package io.github.hongjungwan.duallog.core.format;

import io.github.hongjungwan.duallog.api.domain.LogEvent;
import io.github.hongjungwan.duallog.api.redaction.OutputChannel;
import io.github.hongjungwan.duallog.core.redaction.RedactionEngine;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * 로그 이벤트를 콘솔/파일 두 채널 텍스트로 렌더링.
 *
 * <p>공통 레이아웃: {@code glyph [callerId[:line]] message | k=v, k=v} + 스택 트레이스 블록.
 * 파일 채널에는 {@code [timestamp] rank } 접두어와 개행이 붙는다.</p>
 */
public class LogEntryFormatter {

    public static final String TIMESTAMP_PATTERN = "uuuu-MM-dd HH:mm:ss.SSS";

    private static final String METADATA_SEPARATOR = " | ";

    private final RedactionEngine redactionEngine;
    private final StackTraceRenderer stackTraceRenderer;
    private final DateTimeFormatter timestampFormatter;

    public LogEntryFormatter(RedactionEngine redactionEngine, StackTraceRenderer stackTraceRenderer, ZoneId zoneId) {
        this.redactionEngine = redactionEngine;
        this.stackTraceRenderer = stackTraceRenderer;
        this.timestampFormatter = DateTimeFormatter.ofPattern(TIMESTAMP_PATTERN).withZone(zoneId);
    }

    public FormattedLogLine format(LogEvent event) {
        String header = event.getLevel().getGlyph() + " [" + event.callerLabel() + "] ";

        String consoleMessage = redactionEngine.resolve(event.getMessage(), OutputChannel.CONSOLE);
        String persistedMessage = redactionEngine.resolve(event.getMessage(), OutputChannel.PERSISTED);

        String trailer = renderMetadata(event.getMetadata()) + renderStackTrace(event);

        String consoleText = header + consoleMessage + trailer;
        String persistedText = "[" + timestampFormatter.format(event.getTimestamp()) + "] "
                + event.getLevel().getRank() + " "
                + header + persistedMessage + trailer + "\n";

        return new FormattedLogLine(consoleText, persistedText);
    }

    private String renderMetadata(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return "";
        }

        StringBuilder sb = new StringBuilder(METADATA_SEPARATOR);
        boolean first = true;
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.toString();
    }

    private String renderStackTrace(LogEvent event) {
        if (!event.isIncludeStackTrace() || !event.getLevel().allowsStackTrace()) {
            return "";
        }
        return stackTraceRenderer.render(event.getStackTrace());
    }
}
