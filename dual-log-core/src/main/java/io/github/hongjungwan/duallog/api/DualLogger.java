package io.github.hongjungwan.duallog.api;

import io.github.hongjungwan.duallog.api.domain.LogLevel;
import io.github.hongjungwan.duallog.api.redaction.RedactableMessage;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 호출자 식별자에 바인딩된 로거. 콘솔에는 원문, 파일에는 민감정보가 제거된 텍스트를 기록한다.
 *
 * <p>민감 값은 {@link io.github.hongjungwan.duallog.api.redaction.Redacted} 로 감싸
 * {@link RedactableMessage#format(String, Object...)} 로 전달한다.</p>
 */
public interface DualLogger {

    void debug(String message);

    void debug(String message, Map<String, ?> metadata);

    void debug(RedactableMessage message);

    void debug(RedactableMessage message, Map<String, ?> metadata);

    void info(String message);

    void info(String message, Map<String, ?> metadata);

    void info(RedactableMessage message);

    void info(RedactableMessage message, Map<String, ?> metadata);

    void warning(String message);

    void warning(String message, Map<String, ?> metadata);

    void warning(RedactableMessage message);

    void warning(RedactableMessage message, Map<String, ?> metadata);

    /** 스택 트레이스 없이 기록 */
    void error(String message);

    void error(String message, Map<String, ?> metadata);

    void error(RedactableMessage message);

    void error(RedactableMessage message, Map<String, ?> metadata);

    void error(String message, boolean includeStackTrace);

    void error(RedactableMessage message, Map<String, ?> metadata, boolean includeStackTrace);

    /** 기본적으로 호출 스택 포함 */
    void critical(String message);

    void critical(String message, Map<String, ?> metadata);

    void critical(RedactableMessage message);

    void critical(RedactableMessage message, Map<String, ?> metadata);

    void critical(String message, boolean includeStackTrace);

    void critical(RedactableMessage message, Map<String, ?> metadata, boolean includeStackTrace);

    /**
     * 전체 인자 기록.
     *
     * @param lineNumber 호출 라인 번호, 모르면 null
     */
    void log(LogLevel level, RedactableMessage message, Map<String, ?> metadata,
             Integer lineNumber, boolean includeStackTrace);

    boolean isEnabled(LogLevel level);

    /** 호출자 식별자 */
    String getName();

    /** Fluent API 빌더 생성 */
    default LogBuilder atLevel(LogLevel level) {
        return new LogBuilder(this, level);
    }

    /** 로그 이벤트 빌더. 메서드 체이닝 지원. */
    class LogBuilder {
        private final DualLogger logger;
        private final LogLevel level;
        private RedactableMessage message = RedactableMessage.of("");
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private Integer lineNumber;
        private boolean includeStackTrace;

        LogBuilder(DualLogger logger, LogLevel level) {
            this.logger = logger;
            this.level = level;
            this.includeStackTrace = level == LogLevel.CRITICAL;
        }

        public LogBuilder message(String message) {
            this.message = RedactableMessage.of(message);
            return this;
        }

        public LogBuilder message(RedactableMessage message) {
            this.message = message;
            return this;
        }

        /** {@code {}} 자리표시자 포맷. Redacted 인자는 마킹된 값이 된다. */
        public LogBuilder message(String pattern, Object... args) {
            this.message = RedactableMessage.format(pattern, args);
            return this;
        }

        public LogBuilder line(int lineNumber) {
            this.lineNumber = lineNumber;
            return this;
        }

        public LogBuilder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public LogBuilder stackTrace(boolean includeStackTrace) {
            this.includeStackTrace = includeStackTrace;
            return this;
        }

        /** 설정된 레벨로 로그 출력 */
        public void log() {
            logger.log(level, message, metadata, lineNumber, includeStackTrace);
        }
    }
}
