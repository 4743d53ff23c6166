package io.github.hongjungwan.duallog.api;

import io.github.hongjungwan.duallog.api.config.DualLogConfig;
import io.github.hongjungwan.duallog.api.domain.LogEntry;
import io.github.hongjungwan.duallog.api.domain.LogLevel;
import io.github.hongjungwan.duallog.api.redaction.RedactableMessage;
import io.github.hongjungwan.duallog.core.internal.DefaultLogPipeline;
import io.github.hongjungwan.duallog.core.internal.PipelineMetrics;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 이중 채널 로그 파이프라인. 레벨 필터, 포맷, 콘솔 전달, 파일 버퍼/로테이션, 조회를 담당한다.
 *
 * <p>전역 싱글톤이 아니다. 애플리케이션이 인스턴스를 만들고 수명을 관리한다.</p>
 */
public interface LogPipeline extends AutoCloseable {

    /** 설정 검증 후 파이프라인 생성 및 시작 */
    static LogPipeline create(DualLogConfig config) {
        DefaultLogPipeline pipeline = new DefaultLogPipeline(config);
        pipeline.start();
        return pipeline;
    }

    /** 클래스 simple name 을 호출자 식별자로 쓰는 로거 */
    DualLogger getLogger(Class<?> clazz);

    DualLogger getLogger(String callerId);

    /**
     * 이벤트 기록. 호출 스레드는 파일 I/O 를 기다리지 않는다.
     *
     * @param lineNumber 호출 라인 번호, 모르면 null
     * @param metadata   null 허용
     */
    void log(LogLevel level, RedactableMessage message, String callerId, Integer lineNumber,
             Map<String, ?> metadata, boolean includeStackTrace);

    void setMinimumLevel(LogLevel level);

    LogLevel getMinimumLevel();

    /** 현재 세대 파일 경로 */
    Path getLogFileLocation();

    /** 현재 파일과 존재하는 아카이브 (최신순) */
    List<Path> getAllLogFileLocations();

    /** 모든 세대 내용 (최신순, 구분선 연결). 내용이 없으면 empty. */
    Optional<String> getLogFileContents();

    /** 버퍼를 비우고 모든 세대를 0 바이트로. 완료까지 대기. */
    void clearLogFiles();

    long getLogFileSizeBytes();

    /** 파일 내용을 오래된 순으로 파싱한 전체 엔트리 */
    List<LogEntry> getRecentEntries();

    /**
     * 가장 최근 {@code limit} 개 엔트리 (오래된 것 먼저).
     *
     * @throws IllegalArgumentException limit 이 음수인 경우
     */
    List<LogEntry> getRecentEntries(int limit);

    /** 호출 이전에 기록된 모든 이벤트가 디스크에 기록될 때까지 대기 */
    void forceFlush();

    PipelineMetrics.Snapshot getMetrics();

    void start();

    /** 남은 라인을 기록하고 스레드를 정리한다. 이후 log 호출은 무시된다. */
    @Override
    void close();
}
