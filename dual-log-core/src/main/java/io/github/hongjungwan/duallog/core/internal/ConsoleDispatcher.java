package io.github.hongjungwan.duallog.core.internal;

import io.github.hongjungwan.duallog.api.domain.LogLevel;
import io.github.hongjungwan.duallog.spi.ConsoleSink;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 콘솔 싱크 전달 전용 단일 스레드 실행기. 큐가 가득 차면 버리고, 싱크 예외는 기록 경로로 번지지 않는다.
 */
@Slf4j
class ConsoleDispatcher implements AutoCloseable {

    static final String THREAD_NAME = "dual-log-console";

    private final ConsoleSink sink;
    private final PipelineMetrics metrics;
    private final ThreadPoolExecutor executor;
    private final Duration shutdownTimeout;

    ConsoleDispatcher(ConsoleSink sink, int queueCapacity, PipelineMetrics metrics, Duration shutdownTimeout) {
        this.sink = sink;
        this.metrics = metrics;
        this.shutdownTimeout = shutdownTimeout;
        this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                runnable -> {
                    Thread thread = new Thread(runnable, THREAD_NAME);
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    void dispatch(LogLevel level, String text) {
        try {
            executor.execute(() -> deliver(level, text));
        } catch (RejectedExecutionException e) {
            metrics.recordConsoleDropped();
        }
    }

    private void deliver(LogLevel level, String text) {
        try {
            sink.accept(level, text);
        } catch (RuntimeException e) {
            metrics.recordConsoleFailure();
            log.debug("Console sink failed: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
