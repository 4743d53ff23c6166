package io.github.hongjungwan.duallog.core.internal;

import io.github.hongjungwan.duallog.api.DualLogger;
import io.github.hongjungwan.duallog.api.config.DualLogConfig;
import io.github.hongjungwan.duallog.api.domain.LogEntry;
import io.github.hongjungwan.duallog.api.domain.LogLevel;
import io.github.hongjungwan.duallog.api.redaction.RedactableMessage;
import io.github.hongjungwan.duallog.api.redaction.Redacted;
import io.github.hongjungwan.duallog.spi.ConsoleSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

@DisplayName("DefaultLogPipeline 테스트")
class DefaultLogPipelineTest {

    @TempDir
    Path tempDir;

    private final List<String> console = new CopyOnWriteArrayList<>();
    private DefaultLogPipeline pipeline;

    private DualLogConfig.DualLogConfigBuilder config() {
        return DualLogConfig.builder()
                .logDirectory(tempDir.toString())
                .zoneId(ZoneOffset.UTC);
    }

    private DefaultLogPipeline start(DualLogConfig config, ConsoleSink sink, Clock clock) {
        pipeline = new DefaultLogPipeline(config, sink, clock);
        pipeline.start();
        return pipeline;
    }

    private DefaultLogPipeline start(DualLogConfig config) {
        return start(config, (level, text) -> console.add(text), Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        if (pipeline != null) {
            pipeline.close();
        }
    }

    private static void awaitSize(List<?> list, int size) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (list.size() < size && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
    }

    @Nested
    @DisplayName("레벨 필터")
    class FilterTests {

        @Test
        @DisplayName("최소 레벨 미만 이벤트는 어느 채널에도 기록되지 않아야 한다")
        void shouldDropEventsBelowMinimumLevel() throws Exception {
            // given
            start(config().minimumLevel(LogLevel.WARNING).build());
            DualLogger logger = pipeline.getLogger("Filter");

            // when
            logger.info("ignored");
            logger.debug("ignored too");
            logger.warning("kept");
            pipeline.forceFlush();
            awaitSize(console, 1);

            // then
            assertThat(pipeline.getRecentEntries()).extracting(LogEntry::getMessage).containsExactly("kept");
            assertThat(console).containsExactly("⚠️ [Filter] kept");
            assertThat(pipeline.getMetrics().filtered()).isEqualTo(2);
        }

        @Test
        @DisplayName("최소 레벨 변경은 이후 호출부터 적용되어야 한다")
        void shouldApplyNewMinimumLevel() {
            start(config().build());
            DualLogger logger = pipeline.getLogger("Filter");

            logger.debug("before");
            pipeline.setMinimumLevel(LogLevel.DEBUG);
            logger.debug("after");
            pipeline.forceFlush();

            assertThat(pipeline.getMinimumLevel()).isEqualTo(LogLevel.DEBUG);
            assertThat(logger.isEnabled(LogLevel.DEBUG)).isTrue();
            assertThat(pipeline.getRecentEntries()).extracting(LogEntry::getMessage).containsExactly("after");
        }
    }

    @Nested
    @DisplayName("이중 채널")
    class DualChannelTests {

        @Test
        @DisplayName("콘솔은 실제 값, 파일은 placeholder 를 받아야 한다")
        void shouldSplitChannels() throws Exception {
            // given
            Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00.456Z"), ZoneOffset.UTC);
            start(config().build(), (level, text) -> console.add(text), clock);

            // when
            pipeline.getLogger("Auth").info(RedactableMessage.format("Login {} with {}",
                    Redacted.email("lee@corp.com"), Redacted.password("pw1234")), Map.of("attempt", 2));
            pipeline.forceFlush();
            awaitSize(console, 1);

            // then
            assertThat(console).containsExactly("💙 [Auth] Login lee@corp.com with pw1234 | attempt=2");
            assertThat(pipeline.getLogFileContents()).contains(
                    "[2024-05-01 12:00:00.456] 1 💙 [Auth] Login [REDACTED_EMAIL] with [REDACTED_PASSWORD] | attempt=2\n");
        }

        @Test
        @DisplayName("콘솔 싱크 예외는 파일 기록에 영향을 주지 않아야 한다")
        void shouldIsolateConsoleFailures() throws Exception {
            // given
            ConsoleSink failing = mock(ConsoleSink.class);
            doThrow(new IllegalStateException("console down")).when(failing).accept(eq(LogLevel.ERROR), anyString());
            start(config().build(), failing, Clock.systemUTC());

            // when
            pipeline.getLogger("Billing").error("Invoice failed");
            pipeline.forceFlush();

            // then
            verify(failing, timeout(2000)).accept(eq(LogLevel.ERROR), anyString());
            assertThat(pipeline.getRecentEntries()).extracting(LogEntry::getMessage).containsExactly("Invoice failed");
        }
    }

    @Nested
    @DisplayName("파일 조회와 정리")
    class FileTests {

        @Test
        @DisplayName("start 전에도 forceFlush 가 반환되면 라인이 파일에 있어야 한다")
        void shouldFlushToDiskWithoutStart() {
            // given
            pipeline = new DefaultLogPipeline(config().build(), null, Clock.systemUTC());
            pipeline.log(LogLevel.INFO, RedactableMessage.of("hello"), "Early", null, Map.of(), false);

            // when
            pipeline.forceFlush();

            // then
            assertThat(pipeline.getLogFileSizeBytes()).isPositive();
            assertThat(pipeline.getLogFileContents()).hasValueSatisfying(text -> assertThat(text).contains("[Early] hello"));
        }

        @Test
        @DisplayName("기록이 없으면 내용은 empty 여야 한다")
        void shouldReturnEmptyContentsInitially() {
            start(config().build());

            assertThat(pipeline.getLogFileContents()).isEmpty();
            assertThat(pipeline.getLogFileLocation()).isEqualTo(tempDir.resolve("app_logs.txt"));
        }

        @Test
        @DisplayName("clearLogFiles 후 크기는 0 이어야 한다")
        void shouldClearToZeroBytes() {
            // given
            start(config().build());
            DualLogger logger = pipeline.getLogger("Cleaner");
            logger.info("one");
            pipeline.forceFlush();
            logger.info("two (still buffered)");

            // when
            pipeline.clearLogFiles();
            pipeline.forceFlush();

            // then
            assertThat(pipeline.getLogFileSizeBytes()).isZero();
            assertThat(pipeline.getLogFileContents()).isEmpty();
        }

        @Test
        @DisplayName("로테이션 후 여러 파일이 생기고 전체 크기는 상한 안이어야 한다")
        void shouldRotateAndBoundTotalSize() {
            // given
            long maxFileSize = 1024;
            int archives = 2;
            start(config()
                    .maxFileSizeBytes(maxFileSize)
                    .maxArchiveFiles(archives)
                    .bufferSizeThreshold(1)
                    .build());
            DualLogger logger = pipeline.getLogger("Rotator");

            // when
            for (int i = 0; i < 300; i++) {
                logger.info("line " + i + " " + "x".repeat(40));
            }
            pipeline.forceFlush();

            // then
            List<Path> files = pipeline.getAllLogFileLocations();
            assertThat(files).hasSizeGreaterThanOrEqualTo(2).hasSizeLessThanOrEqualTo(archives + 1);
            assertThat(files.get(0)).isEqualTo(pipeline.getLogFileLocation());
            assertThat(pipeline.getLogFileSizeBytes()).isLessThanOrEqualTo((archives + 1) * (maxFileSize + 200));
            assertThat(pipeline.getMetrics().rotations()).isGreaterThan(0);
        }

        @Test
        @DisplayName("여러 세대 내용은 최신 파일부터 구분선으로 이어져야 한다")
        void shouldJoinNewestFirst() throws Exception {
            start(config().build());
            Files.writeString(tempDir.resolve("app_logs_1.txt"), "older\n");
            Files.writeString(tempDir.resolve("app_logs.txt"), "newer\n");

            Optional<String> contents = pipeline.getLogFileContents();

            assertThat(contents).contains("newer\n\n--- Previous Log File ---\nolder\n");
        }
    }

    @Nested
    @DisplayName("최근 엔트리")
    class RecentEntryTests {

        @Test
        @DisplayName("limit 만큼 가장 최근 엔트리를 오래된 순으로 반환해야 한다")
        void shouldReturnLastEntries() {
            start(config().build());
            DualLogger logger = pipeline.getLogger("Recent");
            for (int i = 1; i <= 5; i++) {
                logger.info("event " + i);
            }
            pipeline.forceFlush();

            assertThat(pipeline.getRecentEntries(2)).extracting(LogEntry::getMessage)
                    .containsExactly("event 4", "event 5");
            assertThat(pipeline.getRecentEntries(0)).isEmpty();
            assertThat(pipeline.getRecentEntries(100)).hasSize(5);
        }

        @Test
        @DisplayName("음수 limit 은 거부해야 한다")
        void shouldRejectNegativeLimit() {
            start(config().build());

            assertThatThrownBy(() -> pipeline.getRecentEntries(-1))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("fluent 빌더의 라인 번호와 메타데이터가 복원되어야 한다")
        void shouldKeepLineNumberFromBuilder() {
            start(config().build());

            pipeline.getLogger(DefaultLogPipelineTest.class)
                    .atLevel(LogLevel.WARNING)
                    .message("Disk {} full", "/var")
                    .line(77)
                    .metadata("usage", "97%")
                    .log();
            pipeline.forceFlush();

            LogEntry entry = pipeline.getRecentEntries(1).get(0);
            assertThat(entry.getCallerId()).isEqualTo("DefaultLogPipelineTest");
            assertThat(entry.getLineNumber()).isEqualTo(77);
            assertThat(entry.getMessage()).isEqualTo("Disk /var full | usage=97%");
        }

        @Test
        @DisplayName("여러 줄 메시지의 이어지는 줄은 파싱 실패로 세지 않아야 한다")
        void shouldCountOnlyBracketedLinesAsParseFailures() throws Exception {
            // given
            start(config().build());
            pipeline.getLogger("Multi").info("first line\nsecond line");
            pipeline.forceFlush();
            Files.writeString(pipeline.getLogFileLocation(), "[broken entry\n", StandardOpenOption.APPEND);

            // when
            List<LogEntry> entries = pipeline.getRecentEntries();

            // then
            assertThat(entries).extracting(LogEntry::getMessage).containsExactly("first line");
            assertThat(pipeline.getMetrics().parseFailures()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("스택 트레이스")
    class StackTraceTests {

        @Test
        @DisplayName("critical 은 기본으로 호출 스택을 포함하고 파이프라인 프레임은 빠져야 한다")
        void shouldIncludeCallerFramesForCritical() {
            start(config().build());

            pipeline.getLogger("Ops").critical("Database unreachable");
            pipeline.forceFlush();

            String contents = pipeline.getLogFileContents().orElseThrow();
            assertThat(contents).contains("Database unreachable\n    at ", DefaultLogPipelineTest.class.getName());
            assertThat(contents).doesNotContain("java.lang.Thread.getStackTrace", "DefaultDualLogger.critical");
        }

        @Test
        @DisplayName("error 는 기본으로 호출 스택을 포함하지 않아야 한다")
        void shouldNotIncludeTraceForErrorByDefault() {
            start(config().build());

            pipeline.getLogger("Ops").error("Retry scheduled");
            pipeline.getLogger("Ops").error("With trace", true);
            pipeline.forceFlush();

            String contents = pipeline.getLogFileContents().orElseThrow();
            assertThat(contents).contains("Retry scheduled\n[");
            assertThat(contents).contains("With trace\n    at ");
        }
    }

    @Nested
    @DisplayName("동시성과 수명주기")
    class ConcurrencyTests {

        @Test
        @DisplayName("동시 생산자의 스레드별 순서가 유지되어야 한다")
        void shouldPreservePerThreadOrder() throws Exception {
            // given
            start(config().build());
            int threads = 4;
            int perThread = 100;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch ready = new CountDownLatch(1);

            // when
            for (int t = 0; t < threads; t++) {
                String caller = "Worker" + t;
                executor.submit(() -> {
                    ready.await();
                    DualLogger logger = pipeline.getLogger(caller);
                    for (int i = 0; i < perThread; i++) {
                        logger.info("seq " + i);
                    }
                    return null;
                });
            }
            ready.countDown();
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
            pipeline.forceFlush();

            // then
            List<LogEntry> entries = pipeline.getRecentEntries();
            assertThat(entries).hasSize(threads * perThread);
            for (int t = 0; t < threads; t++) {
                String caller = "Worker" + t;
                List<String> messages = new ArrayList<>();
                entries.stream()
                        .filter(entry -> entry.getCallerId().equals(caller))
                        .forEach(entry -> messages.add(entry.getMessage()));
                List<String> expected = new ArrayList<>();
                for (int i = 0; i < perThread; i++) {
                    expected.add("seq " + i);
                }
                assertThat(messages).containsExactlyElementsOf(expected);
            }
        }

        @Test
        @DisplayName("같은 호출자 식별자는 같은 로거를 반환해야 한다")
        void shouldCacheLoggers() {
            start(config().build());

            assertThat(pipeline.getLogger("Same")).isSameAs(pipeline.getLogger("Same"));
            assertThat(pipeline.getLogger(DefaultLogPipelineTest.class).getName()).isEqualTo("DefaultLogPipelineTest");
        }

        @Test
        @DisplayName("close 이후 log 는 무시되고 재시작은 거부되어야 한다")
        void shouldIgnoreLogsAfterClose() {
            start(config().build());
            DualLogger logger = pipeline.getLogger("Late");
            logger.info("before close");

            pipeline.close();
            logger.info("after close");

            assertThat(pipeline.getRecentEntries()).extracting(LogEntry::getMessage).containsExactly("before close");
            assertThatThrownBy(() -> pipeline.start()).isInstanceOf(DualLogException.class);
        }

        @Test
        @DisplayName("잘못된 설정은 생성 시점에 거부되어야 한다")
        void shouldRejectInvalidConfig() {
            DualLogConfig invalid = config().maxArchiveFiles(0).build();

            assertThatThrownBy(() -> new DefaultLogPipeline(invalid))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
