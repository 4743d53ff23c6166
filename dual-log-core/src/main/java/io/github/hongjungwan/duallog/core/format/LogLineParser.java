package io.github.hongjungwan.duallog.core.format;

import io.github.hongjungwan.duallog.api.domain.LogEntry;
import io.github.hongjungwan.duallog.api.domain.LogLevel;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 파일 라인을 {@link LogEntry} 로 복원. 문법에 맞지 않는 라인은 건너뛴다.
 *
 * <p>문법: {@code [timestamp] LEVEL glyph [callerId[:lineNumber]] message}.
 * 라인 번호가 없는 구 형식도 파싱된다.</p>
 */
public class LogLineParser {

    private static final Pattern LINE_PATTERN =
            Pattern.compile("\\[(.*?)\\] (\\w+) (\\S+) \\[(.*?)\\] (.*)");
    private static final Pattern CALLER_WITH_LINE = Pattern.compile("(.*):(\\d+)");

    private final DateTimeFormatter timestampFormatter;
    private final ZoneId zoneId;

    public LogLineParser(ZoneId zoneId) {
        this.zoneId = zoneId;
        this.timestampFormatter = DateTimeFormatter.ofPattern(LogEntryFormatter.TIMESTAMP_PATTERN)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    public Optional<LogEntry> parse(String line) {
        if (line == null || line.isEmpty()) {
            return Optional.empty();
        }

        Matcher matcher = LINE_PATTERN.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }

        Optional<Instant> timestamp = parseTimestamp(matcher.group(1));
        Optional<LogLevel> level = LogLevel.fromToken(matcher.group(2));
        if (timestamp.isEmpty() || level.isEmpty()) {
            return Optional.empty();
        }

        String callerId = matcher.group(4);
        Integer lineNumber = null;
        Matcher callerMatcher = CALLER_WITH_LINE.matcher(callerId);
        if (callerMatcher.matches()) {
            try {
                lineNumber = Integer.parseInt(callerMatcher.group(2));
                callerId = callerMatcher.group(1);
            } catch (NumberFormatException e) {
                // int 범위를 넘는 숫자는 callerId 일부로 취급
                lineNumber = null;
            }
        }

        return Optional.of(LogEntry.builder()
                .timestamp(timestamp.get())
                .level(level.get())
                .glyph(matcher.group(3))
                .callerId(callerId)
                .lineNumber(lineNumber)
                .message(matcher.group(5))
                .build());
    }

    /** 여러 줄 텍스트 파싱. 빈 줄, 스택 트레이스 줄, 구분선은 결과에서 빠진다. */
    public List<LogEntry> parseAll(String text) {
        List<LogEntry> entries = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return entries;
        }
        text.lines()
                .filter(line -> !line.isBlank())
                .forEach(line -> parse(line).ifPresent(entries::add));
        return entries;
    }

    private Optional<Instant> parseTimestamp(String value) {
        try {
            return Optional.of(LocalDateTime.parse(value, timestampFormatter).atZone(zoneId).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
