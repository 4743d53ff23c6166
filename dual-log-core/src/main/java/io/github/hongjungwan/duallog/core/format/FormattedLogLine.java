package io.github.hongjungwan.duallog.core.format;

/**
 * 이벤트 1건의 두 채널 렌더링 결과.
 *
 * @param consoleText   콘솔 싱크용. 마킹 값 실제 값, 타임스탬프/rank 없음, 개행 없음
 * @param persistedText 파일용. 스캔/placeholder 적용, 개행으로 끝남
 */
public record FormattedLogLine(String consoleText, String persistedText) {
}
