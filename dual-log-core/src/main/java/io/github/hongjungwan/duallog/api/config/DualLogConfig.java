package io.github.hongjungwan.duallog.api.config;

import io.github.hongjungwan.duallog.api.domain.LogLevel;
import io.github.hongjungwan.duallog.api.redaction.RedactionRule;
import lombok.Builder;
import lombok.Getter;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

/**
 * 파이프라인 설정. 파일 위치, 로테이션, 버퍼/flush, 콘솔 싱크, 자동 스캔 설정 포함.
 */
@Getter
@Builder(toBuilder = true)
public class DualLogConfig {

    /** 로그 파일 디렉토리 */
    @Builder.Default
    private final String logDirectory = "logs";

    /** 현재 세대 파일 기본 이름 (아카이브는 {@code <base>_<n><ext>}) */
    @Builder.Default
    private final String baseFileName = "app_logs";

    /** 로그 파일 확장자 */
    @Builder.Default
    private final String fileExtension = ".txt";

    /** 초기 최소 로그 레벨 */
    @Builder.Default
    private final LogLevel minimumLevel = LogLevel.INFO;

    /** 로테이션 기준 현재 파일 크기 (bytes) */
    @Builder.Default
    private final long maxFileSizeBytes = 5L * 1024 * 1024;

    /** 보관할 아카이브 세대 수 */
    @Builder.Default
    private final int maxArchiveFiles = 3;

    /** 버퍼 라인 수가 이 값에 도달하면 flush */
    @Builder.Default
    private final int bufferSizeThreshold = 25;

    /** 마지막 flush 이후 이 시간이 지나면 flush, 주기 tick 간격으로도 사용 */
    @Builder.Default
    private final Duration maxFlushInterval = Duration.ofSeconds(5);

    /** writer 큐 용량. 가득 차면 라인은 버려진다. */
    @Builder.Default
    private final int queueCapacity = 8192;

    /** 콘솔 싱크 전달 활성화 */
    @Builder.Default
    private final boolean consoleEnabled = true;

    /** 콘솔 전달 큐 용량 */
    @Builder.Default
    private final int consoleQueueCapacity = 1024;

    /** 파일 채널 자동 스캔 활성화 (명시적 마킹은 항상 적용) */
    @Builder.Default
    private final boolean redactionEnabled = true;

    /** 기본 규칙 뒤에 적용되는 추가 스캔 규칙 */
    @Builder.Default
    private final List<RedactionRule> additionalRedactionRules = List.of();

    /** 스택 트레이스 최대 프레임 수 */
    @Builder.Default
    private final int stackTraceMaxFrames = 10;

    /** 타임스탬프 기록/파싱 시간대 */
    @Builder.Default
    private final ZoneId zoneId = ZoneId.systemDefault();

    /** forceFlush / clear 최대 대기 시간 */
    @Builder.Default
    private final Duration operationTimeout = Duration.ofSeconds(10);

    public Path getLogDirectoryPath() {
        return Paths.get(logDirectory);
    }

    /**
     * 설정 값 검증.
     *
     * @throws IllegalArgumentException 값이 범위를 벗어난 경우
     */
    public DualLogConfig validate() {
        requireText(logDirectory, "logDirectory");
        requireText(baseFileName, "baseFileName");
        if (fileExtension == null) {
            throw new IllegalArgumentException("fileExtension must not be null");
        }
        if (minimumLevel == null) {
            throw new IllegalArgumentException("minimumLevel must not be null");
        }
        requirePositive(maxFileSizeBytes, "maxFileSizeBytes");
        requirePositive(maxArchiveFiles, "maxArchiveFiles");
        requirePositive(bufferSizeThreshold, "bufferSizeThreshold");
        requirePositive(queueCapacity, "queueCapacity");
        requirePositive(consoleQueueCapacity, "consoleQueueCapacity");
        requirePositive(stackTraceMaxFrames, "stackTraceMaxFrames");
        requirePositive(maxFlushInterval, "maxFlushInterval");
        requirePositive(operationTimeout, "operationTimeout");
        if (additionalRedactionRules == null) {
            throw new IllegalArgumentException("additionalRedactionRules must not be null");
        }
        if (zoneId == null) {
            throw new IllegalArgumentException("zoneId must not be null");
        }
        return this;
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    private static void requirePositive(long value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive but was " + value);
        }
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration but was " + value);
        }
    }

    /** 기본 설정 */
    public static DualLogConfig defaultConfig() {
        return DualLogConfig.builder().build();
    }

    /** 지정 디렉토리를 쓰는 기본 설정 */
    public static DualLogConfig forDirectory(Path directory) {
        return DualLogConfig.builder()
                .logDirectory(directory.toString())
                .build();
    }
}
