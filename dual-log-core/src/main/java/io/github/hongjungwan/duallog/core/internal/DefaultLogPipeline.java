package io.github.hongjungwan.duallog.core.internal;

import io.github.hongjungwan.duallog.api.DualLogger;
import io.github.hongjungwan.duallog.api.LogPipeline;
import io.github.hongjungwan.duallog.api.config.DualLogConfig;
import io.github.hongjungwan.duallog.api.domain.LogEntry;
import io.github.hongjungwan.duallog.api.domain.LogEvent;
import io.github.hongjungwan.duallog.api.domain.LogLevel;
import io.github.hongjungwan.duallog.api.redaction.RedactableMessage;
import io.github.hongjungwan.duallog.core.file.LogFileRotation;
import io.github.hongjungwan.duallog.core.file.LogFileWriter;
import io.github.hongjungwan.duallog.core.format.FormattedLogLine;
import io.github.hongjungwan.duallog.core.format.LogEntryFormatter;
import io.github.hongjungwan.duallog.core.format.LogLineParser;
import io.github.hongjungwan.duallog.core.format.StackTraceRenderer;
import io.github.hongjungwan.duallog.core.redaction.RedactionEngine;
import io.github.hongjungwan.duallog.spi.ConsoleSink;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 기본 파이프라인 구현. 레벨 필터 → 포맷 → 콘솔 전달 + writer 큐 적재.
 *
 * <p>호출 스레드는 포맷까지만 수행한다. 콘솔 싱크는 전용 스레드, 파일 쓰기는 writer 스레드 몫이다.</p>
 */
@Slf4j
public class DefaultLogPipeline implements LogPipeline {

    static final String FILE_SEPARATOR = "\n--- Previous Log File ---\n";

    private final Clock clock;
    private final PipelineMetrics metrics = new PipelineMetrics();
    private final LogEntryFormatter formatter;
    private final LogLineParser parser;
    private final LogFileRotation rotation;
    private final LogFileWriter writer;
    private final ConsoleDispatcher consoleDispatcher;
    private final ConcurrentMap<String, DualLogger> loggers = new ConcurrentHashMap<>();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile LogLevel minimumLevel;

    public DefaultLogPipeline(DualLogConfig config) {
        this(config, new Slf4jConsoleSink(), Clock.systemUTC());
    }

    /**
     * @param consoleSink null 이면 콘솔 전달 없음
     * @throws IllegalArgumentException 설정 값이 잘못된 경우
     */
    public DefaultLogPipeline(DualLogConfig config, ConsoleSink consoleSink, Clock clock) {
        config.validate();
        this.clock = clock;
        this.minimumLevel = config.getMinimumLevel();

        RedactionEngine redactionEngine = new RedactionEngine(config);
        this.formatter = new LogEntryFormatter(redactionEngine,
                new StackTraceRenderer(config.getStackTraceMaxFrames()), config.getZoneId());
        this.parser = new LogLineParser(config.getZoneId());
        this.rotation = new LogFileRotation(config, metrics);
        this.writer = new LogFileWriter(config, rotation, metrics);
        this.consoleDispatcher = config.isConsoleEnabled() && consoleSink != null
                ? new ConsoleDispatcher(consoleSink, config.getConsoleQueueCapacity(), metrics, config.getOperationTimeout())
                : null;
    }

    @Override
    public void start() {
        if (closed.get()) {
            throw new DualLogException("Pipeline already closed: " + rotation.currentFile());
        }
        if (started.compareAndSet(false, true)) {
            writer.start();
            log.debug("DualLog pipeline started. minimumLevel={}, file={}", minimumLevel, rotation.currentFile());
        }
    }

    @Override
    public DualLogger getLogger(Class<?> clazz) {
        String simpleName = clazz.getSimpleName();
        return getLogger(simpleName.isEmpty() ? clazz.getName() : simpleName);
    }

    @Override
    public DualLogger getLogger(String callerId) {
        return loggers.computeIfAbsent(callerId, id -> new DefaultDualLogger(id, this));
    }

    @Override
    public void log(LogLevel level, RedactableMessage message, String callerId, Integer lineNumber,
                    Map<String, ?> metadata, boolean includeStackTrace) {
        if (closed.get()) {
            return;
        }
        if (level == null || !level.isAtLeast(minimumLevel)) {
            metrics.recordFiltered();
            return;
        }

        try {
            boolean captureTrace = includeStackTrace && level.allowsStackTrace();
            LogEvent event = LogEvent.builder()
                    .timestamp(clock.instant().truncatedTo(ChronoUnit.MILLIS))
                    .level(level)
                    .callerId(callerId)
                    .lineNumber(lineNumber)
                    .message(message != null ? message : RedactableMessage.of(""))
                    .metadata(toMetadata(metadata))
                    .includeStackTrace(captureTrace)
                    .stackTrace(captureTrace ? captureStackTrace() : List.of())
                    .build();

            FormattedLogLine line = formatter.format(event);
            metrics.recordLogged();

            if (consoleDispatcher != null) {
                consoleDispatcher.dispatch(level, line.consoleText());
            }
            writer.enqueue(line.persistedText());
        } catch (RuntimeException e) {
            log.warn("Failed to log event from {}: {}", callerId, e.getMessage());
        }
    }

    private static Map<String, String> toMetadata(Map<String, ?> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        Map<String, String> rendered = new LinkedHashMap<>();
        metadata.forEach((key, value) -> rendered.put(key, String.valueOf(value)));
        return rendered;
    }

    private static List<StackTraceElement> captureStackTrace() {
        return Arrays.asList(Thread.currentThread().getStackTrace());
    }

    @Override
    public void setMinimumLevel(LogLevel level) {
        if (level == null) {
            throw new IllegalArgumentException("level must not be null");
        }
        this.minimumLevel = level;
    }

    @Override
    public LogLevel getMinimumLevel() {
        return minimumLevel;
    }

    @Override
    public Path getLogFileLocation() {
        return rotation.currentFile();
    }

    @Override
    public List<Path> getAllLogFileLocations() {
        return rotation.existingGenerations();
    }

    @Override
    public Optional<String> getLogFileContents() {
        List<String> contents = new ArrayList<>();
        for (Path file : rotation.existingGenerations()) {
            readFile(file).ifPresent(contents::add);
        }

        String joined = String.join(FILE_SEPARATOR, contents);
        return joined.isEmpty() ? Optional.empty() : Optional.of(joined);
    }

    private Optional<String> readFile(Path file) {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Failed to read log file {}: {}", file, e.getMessage());
            metrics.recordIoFailure();
            return Optional.empty();
        }
    }

    @Override
    public void clearLogFiles() {
        writer.clear();
    }

    @Override
    public long getLogFileSizeBytes() {
        return rotation.totalSizeBytes();
    }

    @Override
    public List<LogEntry> getRecentEntries() {
        return readAllEntries();
    }

    @Override
    public List<LogEntry> getRecentEntries(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative but was " + limit);
        }
        List<LogEntry> entries = readAllEntries();
        if (entries.size() <= limit) {
            return entries;
        }
        return new ArrayList<>(entries.subList(entries.size() - limit, entries.size()));
    }

    /** 오래된 세대부터 읽어 시간 순으로 파싱 */
    private List<LogEntry> readAllEntries() {
        List<Path> generations = new ArrayList<>(rotation.existingGenerations());
        Collections.reverse(generations);

        List<LogEntry> entries = new ArrayList<>();
        for (Path file : generations) {
            readFile(file).ifPresent(text -> {
                List<LogEntry> parsed = parser.parseAll(text);
                // 이어지는 줄과 세대 구분선은 항목 후보가 아니다
                long candidates = text.lines()
                        .filter(line -> line.startsWith("["))
                        .count();
                if (candidates > parsed.size()) {
                    metrics.recordParseFailures(candidates - parsed.size());
                }
                entries.addAll(parsed);
            });
        }
        return entries;
    }

    @Override
    public void forceFlush() {
        writer.forceFlush();
    }

    @Override
    public PipelineMetrics.Snapshot getMetrics() {
        return metrics.getSnapshot();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        writer.close();
        if (consoleDispatcher != null) {
            consoleDispatcher.close();
        }
        loggers.clear();
        log.debug("DualLog pipeline closed. {}", metrics.getSnapshot());
    }
}
