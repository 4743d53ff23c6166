package io.github.hongjungwan.duallog.core.internal;

import io.github.hongjungwan.duallog.api.config.DualLogConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 파이프라인 자가 진단. 로그 디렉토리 접근, 쓰기 권한, 디스크 여유 공간 검사.
 */
@Slf4j
public class LogDoctor {

    static final String PROBE_FILE_NAME = ".dual-log-probe";

    private final DualLogConfig config;

    public LogDoctor(DualLogConfig config) {
        this.config = config;
    }

    /** 모든 진단 검사 실행 */
    public DiagnosticReport diagnose() {
        log.info("Running DualLog diagnostic checks...");

        List<DiagnosticResult> results = new ArrayList<>();
        results.add(checkDirectoryAccess());
        results.add(checkWritePermission());
        results.add(checkFreeSpace());

        DiagnosticReport report = new DiagnosticReport(results);

        if (report.hasFailures()) {
            log.warn("Diagnostic failures detected:");
            report.getFailedChecks().forEach(result ->
                    log.warn("  - {}: {}", result.getName(), result.getMessage())
            );
            log.warn("Log lines will only reach the console until the log directory is usable");
        } else {
            log.info("All diagnostic checks passed successfully");
        }

        return report;
    }

    /** 검사 1: 로그 디렉토리 생성/쓰기 가능 여부 */
    private DiagnosticResult checkDirectoryAccess() {
        Path directory = config.getLogDirectoryPath();
        try {
            Files.createDirectories(directory);

            if (Files.isWritable(directory)) {
                return DiagnosticResult.success("Log Directory Access",
                        "Log directory is accessible: " + directory);
            } else {
                return DiagnosticResult.failure("Log Directory Access",
                        "Log directory is not writable: " + directory);
            }
        } catch (IOException | SecurityException e) {
            return DiagnosticResult.failure("Log Directory Access",
                    "Failed to access log directory: " + e.getMessage());
        }
    }

    /** 검사 2: 실제 쓰기/읽기 */
    private DiagnosticResult checkWritePermission() {
        Path probe = config.getLogDirectoryPath().resolve(PROBE_FILE_NAME);
        try {
            Files.createDirectories(probe.getParent());
            Files.writeString(probe, "probe");
            String content = Files.readString(probe);
            Files.deleteIfExists(probe);

            if ("probe".equals(content)) {
                return DiagnosticResult.success("Disk Write Permission",
                        "Log directory writable: " + probe.getParent());
            } else {
                return DiagnosticResult.failure("Disk Write Permission",
                        "Write verification failed");
            }
        } catch (IOException e) {
            return DiagnosticResult.failure("Disk Write Permission",
                    "Cannot write to log directory: " + e.getMessage());
        }
    }

    /** 검사 3: 한 세대 분량 여유 공간 */
    private DiagnosticResult checkFreeSpace() {
        Path directory = config.getLogDirectoryPath();
        try {
            long usable = Files.getFileStore(directory).getUsableSpace();
            long required = config.getMaxFileSizeBytes();

            if (usable >= required) {
                return DiagnosticResult.success("Free Space",
                        "Usable space " + (usable / 1024) + " KB");
            } else {
                return DiagnosticResult.warning("Free Space",
                        "Usable space " + usable + " bytes is below one log generation (" + required + " bytes)");
            }
        } catch (IOException e) {
            return DiagnosticResult.failure("Free Space",
                    "Failed to read file store: " + e.getMessage());
        }
    }

    /** 진단 결과 */
    public static class DiagnosticResult {
        private final String name;
        private final Status status;
        private final String message;

        public enum Status {
            SUCCESS, WARNING, FAILURE
        }

        private DiagnosticResult(String name, Status status, String message) {
            this.name = name;
            this.status = status;
            this.message = message;
        }

        public static DiagnosticResult success(String name, String message) {
            return new DiagnosticResult(name, Status.SUCCESS, message);
        }

        public static DiagnosticResult warning(String name, String message) {
            return new DiagnosticResult(name, Status.WARNING, message);
        }

        public static DiagnosticResult failure(String name, String message) {
            return new DiagnosticResult(name, Status.FAILURE, message);
        }

        public String getName() {
            return name;
        }

        public Status getStatus() {
            return status;
        }

        public String getMessage() {
            return message;
        }

        public boolean isFailure() {
            return status == Status.FAILURE;
        }
    }

    /** 진단 리포트 */
    public static class DiagnosticReport {
        private final List<DiagnosticResult> results;

        public DiagnosticReport(List<DiagnosticResult> results) {
            this.results = new ArrayList<>(results);
        }

        public boolean hasFailures() {
            return results.stream().anyMatch(DiagnosticResult::isFailure);
        }

        public List<DiagnosticResult> getFailedChecks() {
            return results.stream()
                    .filter(DiagnosticResult::isFailure)
                    .toList();
        }

        public List<DiagnosticResult> getAllResults() {
            return new ArrayList<>(results);
        }
    }
}
