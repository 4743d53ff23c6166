package io.github.hongjungwan.duallog.api.redaction;

/**
 * 렌더링 대상 채널.
 */
public enum OutputChannel {
    /** 외부 콘솔 싱크. 마킹 값은 실제 값으로 해석 */
    CONSOLE,
    /** 로그 파일. 마킹 값은 placeholder, 나머지 텍스트는 자동 스캔 */
    PERSISTED
}
