package io.github.hongjungwan.duallog.core.file;

import io.github.hongjungwan.duallog.api.config.DualLogConfig;
import io.github.hongjungwan.duallog.core.internal.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 단일 writer 스레드 기반 파일 기록기. ArrayBlockingQueue 명령 큐 + 주기 tick.
 *
 * <p>버퍼와 파일 쓰기는 writer 스레드만 다룬다. 생산자는 큐가 가득 차면 기다리지 않고 라인을 버린다.
 * flush 조건: 강제 요청, 버퍼 라인 수 임계값 도달, 마지막 flush 이후 최대 간격 경과.
 * 빈 버퍼는 flush 하지 않는다.</p>
 */
@Slf4j
public class LogFileWriter implements AutoCloseable {

    static final String WRITER_THREAD_NAME = "dual-log-writer";
    static final String TICKER_THREAD_NAME = "dual-log-flush-ticker";

    private static final long POLL_TIMEOUT_MS = 100;

    enum CommandType {
        APPEND, TICK, FLUSH, CLEAR
    }

    private record Command(CommandType type, String line, CompletableFuture<Void> completion) {

        static Command append(String line) {
            return new Command(CommandType.APPEND, line, null);
        }

        static Command tick() {
            return new Command(CommandType.TICK, null, null);
        }

        static Command blocking(CommandType type) {
            return new Command(type, null, new CompletableFuture<>());
        }
    }

    private final LogFileRotation rotation;
    private final PipelineMetrics metrics;
    private final BlockingQueue<Command> queue;
    private final int bufferSizeThreshold;
    private final Duration maxFlushInterval;
    private final Duration operationTimeout;

    /** writer 스레드 전용 */
    private final List<String> buffer = new ArrayList<>();
    private long lastFlushNanos = System.nanoTime();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /** start 와 시작 전 호출 스레드 기록 사이의 경합 방지 */
    private final Object lifecycleLock = new Object();

    private Thread writerThread;
    private ScheduledExecutorService ticker;

    public LogFileWriter(DualLogConfig config, LogFileRotation rotation, PipelineMetrics metrics) {
        this.rotation = rotation;
        this.metrics = metrics;
        this.queue = new ArrayBlockingQueue<>(config.getQueueCapacity());
        this.bufferSizeThreshold = config.getBufferSizeThreshold();
        this.maxFlushInterval = config.getMaxFlushInterval();
        this.operationTimeout = config.getOperationTimeout();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (closed.get() || !started.compareAndSet(false, true)) {
                return;
            }
            startThreads();
        }
    }

    private void startThreads() {
        rotation.ensureCurrentFile();
        lastFlushNanos = System.nanoTime();

        writerThread = new Thread(this::runLoop, WRITER_THREAD_NAME);
        writerThread.setDaemon(true);
        writerThread.start();

        ticker = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, TICKER_THREAD_NAME);
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = maxFlushInterval.toMillis();
        ticker.scheduleAtFixedRate(() -> queue.offer(Command.tick()), intervalMs, intervalMs, TimeUnit.MILLISECONDS);

        log.debug("Log file writer started: {}", rotation.currentFile());
    }

    /**
     * 라인 추가 요청. 호출 스레드를 막지 않는다.
     *
     * @return 큐에 들어갔으면 true, 닫혔거나 큐가 가득 차 버려졌으면 false
     */
    public boolean enqueue(String line) {
        if (closed.get()) {
            return false;
        }

        if (!queue.offer(Command.append(line))) {
            long dropped = metrics.recordDropped();
            if (dropped % 1000 == 0) {
                log.warn("Log writer queue full. Dropped {} lines so far.", dropped);
            }
            return false;
        }
        return true;
    }

    /**
     * 앞서 들어온 모든 라인이 디스크에 기록될 때까지 대기 (최대 operationTimeout).
     * 시작 전이면 writer 스레드 없이 호출 스레드에서 큐를 비우고 기록한다.
     */
    public boolean forceFlush() {
        synchronized (lifecycleLock) {
            if (!started.get()) {
                drainRemaining();
                flushIfNeeded(true);
                return true;
            }
        }
        return submitAndWait(CommandType.FLUSH);
    }

    /** 버퍼를 비우고 모든 세대 파일을 0 바이트로 만든다. 완료까지 대기. */
    public boolean clear() {
        synchronized (lifecycleLock) {
            if (!isRunning()) {
                queue.clear();
                if (!started.get()) {
                    buffer.clear();
                }
                rotation.truncateAll();
                return true;
            }
        }
        return submitAndWait(CommandType.CLEAR);
    }

    public boolean isRunning() {
        return started.get() && !closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        synchronized (lifecycleLock) {
            if (!started.get()) {
                // start 전에 닫힌 경우 호출 스레드에서 남은 라인 기록
                drainRemaining();
                flushIfNeeded(true);
                return;
            }
        }

        ticker.shutdownNow();

        try {
            writerThread.join(operationTimeout.toMillis());
            if (writerThread.isAlive()) {
                log.warn("Log writer did not finish within {}. Interrupting.", operationTimeout);
                writerThread.interrupt();
            }
        } catch (InterruptedException e) {
            writerThread.interrupt();
            Thread.currentThread().interrupt();
        }
    }

    private boolean submitAndWait(CommandType type) {
        if (!isRunning()) {
            return false;
        }

        Command command = Command.blocking(type);
        long timeoutMs = operationTimeout.toMillis();
        try {
            if (!queue.offer(command, timeoutMs, TimeUnit.MILLISECONDS)) {
                log.warn("Timed out enqueuing {} command after {}", type, operationTimeout);
                return false;
            }
            command.completion().get(timeoutMs, TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (TimeoutException e) {
            log.warn("Timed out waiting for {} command after {}", type, operationTimeout);
            return false;
        } catch (ExecutionException e) {
            log.warn("{} command failed", type, e.getCause());
            return false;
        }
    }

    private void runLoop() {
        while (!closed.get() || !queue.isEmpty()) {
            try {
                Command command = queue.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
                if (command != null) {
                    handle(command);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.warn("Error in log writer loop", e);
            }
        }

        drainRemaining();
        flushIfNeeded(true);
        log.debug("Log file writer stopped: {}", metrics.getSnapshot());
    }

    private void drainRemaining() {
        Command command;
        while ((command = queue.poll()) != null) {
            handle(command);
        }
    }

    private void handle(Command command) {
        try {
            switch (command.type()) {
                case APPEND -> {
                    buffer.add(command.line());
                    flushIfNeeded(false);
                }
                case TICK -> flushIfNeeded(false);
                case FLUSH -> flushIfNeeded(true);
                case CLEAR -> {
                    buffer.clear();
                    rotation.truncateAll();
                    lastFlushNanos = System.nanoTime();
                }
            }
            if (command.completion() != null) {
                command.completion().complete(null);
            }
        } catch (RuntimeException e) {
            if (command.completion() != null) {
                command.completion().completeExceptionally(e);
            }
            log.warn("Failed to handle {} command", command.type(), e);
        }
    }

    private void flushIfNeeded(boolean force) {
        if (buffer.isEmpty()) {
            return;
        }

        long now = System.nanoTime();
        boolean due = force
                || buffer.size() >= bufferSizeThreshold
                || now - lastFlushNanos >= maxFlushInterval.toNanos();
        if (!due) {
            return;
        }

        StringBuilder sb = new StringBuilder();
        for (String line : buffer) {
            sb.append(line);
        }
        buffer.clear();
        lastFlushNanos = now;

        byte[] bytes = sb.toString().getBytes(StandardCharsets.UTF_8);
        try {
            rotation.ensureCurrentFile();
            Files.write(rotation.currentFile(), bytes, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            metrics.recordFlush(bytes.length);
        } catch (IOException e) {
            log.warn("Failed to write {} bytes to {}: {}", bytes.length, rotation.currentFile(), e.getMessage());
            metrics.recordIoFailure();
            return;
        }

        rotation.rotateIfNeeded();
    }
}
