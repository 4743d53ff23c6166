package io.github.hongjungwan.duallog.test;

import io.github.hongjungwan.duallog.api.domain.LogEntry;
import io.github.hongjungwan.duallog.api.domain.LogLevel;
import org.assertj.core.api.AbstractAssert;

import java.util.Objects;

/**
 * 파싱된 로그 엔트리 검증용 Fluent API TestKit. AssertJ 스타일 메서드 체이닝 지원.
 */
public class LogEntryAssert extends AbstractAssert<LogEntryAssert, LogEntry> {

    private static final String PLACEHOLDER_PREFIX = "[REDACTED";

    public LogEntryAssert(LogEntry actual) {
        super(actual, LogEntryAssert.class);
    }

    public static LogEntryAssert assertThatEntry(LogEntry actual) {
        return new LogEntryAssert(actual);
    }

    public LogEntryAssert hasLevel(LogLevel expected) {
        isNotNull();

        if (actual.getLevel() != expected) {
            failWithMessage("Expected log level <%s> but was <%s>", expected, actual.getLevel());
        }
        return this;
    }

    /** 레벨 glyph 가 레벨과 일치하는지 검증 */
    public LogEntryAssert hasMatchingGlyph() {
        isNotNull();

        if (!actual.getLevel().getGlyph().equals(actual.getGlyph())) {
            failWithMessage("Expected glyph <%s> for level %s but was <%s>",
                    actual.getLevel().getGlyph(), actual.getLevel(), actual.getGlyph());
        }
        return this;
    }

    public LogEntryAssert hasCallerId(String expected) {
        isNotNull();

        if (!Objects.equals(actual.getCallerId(), expected)) {
            failWithMessage("Expected caller <%s> but was <%s>", expected, actual.getCallerId());
        }
        return this;
    }

    public LogEntryAssert hasLineNumber(int expected) {
        isNotNull();

        if (!actual.hasLineNumber() || actual.getLineNumber() != expected) {
            failWithMessage("Expected line number <%s> but was <%s>", expected, actual.getLineNumber());
        }
        return this;
    }

    public LogEntryAssert hasNoLineNumber() {
        isNotNull();

        if (actual.hasLineNumber()) {
            failWithMessage("Expected no line number but was <%s>", actual.getLineNumber());
        }
        return this;
    }

    public LogEntryAssert messageContains(String expected) {
        isNotNull();

        if (actual.getMessage() == null || !actual.getMessage().contains(expected)) {
            failWithMessage("Expected message to contain <%s> but was <%s>", expected, actual.getMessage());
        }
        return this;
    }

    /** 원문 값이 파일에 남지 않았는지 검증할 때 사용 */
    public LogEntryAssert messageDoesNotContain(String unexpected) {
        isNotNull();

        if (actual.getMessage() != null && actual.getMessage().contains(unexpected)) {
            failWithMessage("Expected message not to contain <%s> but was <%s>", unexpected, actual.getMessage());
        }
        return this;
    }

    /** 메시지에 placeholder 가 하나 이상 있는지 검증 */
    public LogEntryAssert isRedacted() {
        isNotNull();

        if (actual.getMessage() == null || !actual.getMessage().contains(PLACEHOLDER_PREFIX)) {
            failWithMessage("Expected message to contain a redaction placeholder but was <%s>", actual.getMessage());
        }
        return this;
    }

    public LogEntryAssert isNotRedacted() {
        isNotNull();

        if (actual.getMessage() != null && actual.getMessage().contains(PLACEHOLDER_PREFIX)) {
            failWithMessage("Expected message without redaction placeholder but was <%s>", actual.getMessage());
        }
        return this;
    }
}
