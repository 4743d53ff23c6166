package io.github.hongjungwan.duallog.starter;

import io.github.hongjungwan.duallog.api.domain.LogLevel;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * DualLog 파이프라인 설정 Properties (prefix: dual-log).
 */
@Data
@ConfigurationProperties(prefix = "dual-log")
public class DualLogProperties {

    /** 파이프라인 활성화 여부 */
    private boolean enabled = true;

    /** 로그 파일 디렉토리 */
    private String directory = "logs";

    private String baseFileName = "app_logs";

    private String fileExtension = ".txt";

    /** 최소 로그 레벨 (debug, info, warning, error, critical) */
    private LogLevel minimumLevel = LogLevel.INFO;

    /** 로테이션 기준 현재 파일 크기 */
    private DataSize maxFileSize = DataSize.ofMegabytes(5);

    /** 보관할 아카이브 세대 수 */
    private int maxArchiveFiles = 3;

    /** flush 기준 버퍼 라인 수 */
    private int bufferSize = 25;

    /** 최대 flush 간격 */
    private Duration flushInterval = Duration.ofSeconds(5);

    /** writer 큐 용량 */
    private int queueCapacity = 8192;

    private int stackTraceMaxFrames = 10;

    /** 타임스탬프 기록/파싱 시간대 (예: Asia/Seoul). 비우면 시스템 기본값 */
    private String zoneId;

    /** forceFlush, clear, close 의 최대 대기 시간 */
    private Duration operationTimeout = Duration.ofSeconds(10);

    private ConsoleProperties console = new ConsoleProperties();

    private RedactionProperties redaction = new RedactionProperties();

    @Data
    public static class ConsoleProperties {
        private boolean enabled = true;
        private int queueCapacity = 1024;
    }

    @Data
    public static class RedactionProperties {
        /** 파일 채널 자동 스캔 활성화 */
        private boolean enabled = true;

        /** 기본 규칙 뒤에 적용되는 추가 규칙 */
        private List<RuleProperties> rules = new ArrayList<>();
    }

    @Data
    public static class RuleProperties {
        private String name;
        private String pattern;
        private String replacement;
        private boolean caseInsensitive = false;
    }
}
