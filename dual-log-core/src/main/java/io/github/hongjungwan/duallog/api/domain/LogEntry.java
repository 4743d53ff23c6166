package io.github.hongjungwan.duallog.api.domain;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * 파일에서 파싱한 로그 라인. 스택 트레이스 줄은 포함되지 않는다.
 */
@Getter
@Builder
public class LogEntry {

    private final Instant timestamp;

    private final LogLevel level;

    /** 라인에 기록된 glyph */
    private final String glyph;

    private final String callerId;

    /** 라인 번호가 없는 형식이면 null */
    private final Integer lineNumber;

    /** 헤더 뒤 나머지 (메타데이터 포함) */
    private final String message;

    public boolean hasLineNumber() {
        return lineNumber != null;
    }

    @Override
    public String toString() {
        return "LogEntry[" + timestamp + " " + level + " " + callerId
                + (lineNumber == null ? "" : ":" + lineNumber) + " " + message + "]";
    }
}
