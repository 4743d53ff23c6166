package io.github.hongjungwan.duallog.test;

import io.github.hongjungwan.duallog.api.domain.LogLevel;
import io.github.hongjungwan.duallog.spi.ConsoleSink;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 콘솔 채널 출력을 메모리에 모으는 테스트용 싱크.
 */
public class CapturingConsoleSink implements ConsoleSink {

    private final List<Captured> captured = new CopyOnWriteArrayList<>();

    @Override
    public void accept(LogLevel level, String renderedText) {
        captured.add(new Captured(level, renderedText));
    }

    public List<Captured> getCaptured() {
        return List.copyOf(captured);
    }

    public List<String> texts() {
        return captured.stream().map(Captured::text).toList();
    }

    /**
     * 지정 건수가 쌓일 때까지 대기. 콘솔 전달은 비동기다.
     *
     * @return 시간 안에 도달했으면 true
     */
    public boolean awaitCount(int count, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (captured.size() < count) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    public void clear() {
        captured.clear();
    }

    /** 캡처된 콘솔 출력 1건 */
    public record Captured(LogLevel level, String text) {
    }
}
