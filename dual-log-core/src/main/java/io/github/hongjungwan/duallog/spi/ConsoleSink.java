package io.github.hongjungwan.duallog.spi;

import io.github.hongjungwan.duallog.api.domain.LogLevel;

/**
 * 외부 콘솔 싱크 SPI. 마킹 값이 실제 값으로 해석된 텍스트를 받는다.
 *
 * <p>파이프라인은 전용 스레드에서 호출하며 결과를 기다리지 않는다. 구현체에서 던진
 * 예외는 집계만 되고 파일 출력에는 영향을 주지 않는다.</p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ConsoleSink {

    /**
     * 렌더링된 콘솔 라인 전달.
     *
     * @param level        이벤트 레벨 (severity 매핑은 {@link LogLevel#getConsoleLevel()})
     * @param renderedText 타임스탬프 없는 콘솔 라인
     */
    void accept(LogLevel level, String renderedText);
}
