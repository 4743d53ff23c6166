package io.github.hongjungwan.duallog.api.domain;

import io.github.hongjungwan.duallog.api.redaction.RedactableMessage;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 호출 1회에 대응하는 로그 이벤트. 포맷터가 콘솔/파일 두 문자열로 소비한 뒤 버려진다.
 */
@Getter
@Builder
public class LogEvent {

    /** 기록 시각 (밀리초 정밀도) */
    private final Instant timestamp;

    private final LogLevel level;

    /** 호출자 식별자 (예: 클래스 이름) */
    private final String callerId;

    /** 호출 라인 번호, 모르면 null */
    private final Integer lineNumber;

    private final RedactableMessage message;

    /** 삽입 순서가 유지되는 메타데이터. 스캔 대상 아님. */
    @Builder.Default
    private final Map<String, String> metadata = Map.of();

    private final boolean includeStackTrace;

    /** 캡처된 호출 스택 (가장 안쪽 프레임 먼저) */
    @Builder.Default
    private final List<StackTraceElement> stackTrace = List.of();

    /** {@code callerId[:lineNumber]} */
    public String callerLabel() {
        String caller = callerId == null ? "" : callerId;
        return lineNumber == null ? caller : caller + ":" + lineNumber;
    }
}
