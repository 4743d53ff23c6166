package io.github.hongjungwan.duallog.core.file;

import io.github.hongjungwan.duallog.api.config.DualLogConfig;
import io.github.hongjungwan.duallog.core.internal.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * 로그 파일 세대 관리. 현재 파일과 {@code <base>_1 ... <base>_N} 아카이브.
 *
 * <p>I/O 실패는 WARN 로그 후 해당 단계만 건너뛴다. 다음 flush 가 재시도 역할을 한다.</p>
 */
@Slf4j
public class LogFileRotation {

    private final Path directory;
    private final String baseFileName;
    private final String fileExtension;
    private final long maxFileSizeBytes;
    private final int maxArchiveFiles;
    private final PipelineMetrics metrics;

    public LogFileRotation(DualLogConfig config, PipelineMetrics metrics) {
        this.directory = config.getLogDirectoryPath();
        this.baseFileName = config.getBaseFileName();
        this.fileExtension = config.getFileExtension();
        this.maxFileSizeBytes = config.getMaxFileSizeBytes();
        this.maxArchiveFiles = config.getMaxArchiveFiles();
        this.metrics = metrics;
    }

    public Path currentFile() {
        return directory.resolve(baseFileName + fileExtension);
    }

    /** 아카이브 세대 파일 (1 = 가장 최근 아카이브) */
    public Path generationFile(int generation) {
        if (generation <= 0) {
            return currentFile();
        }
        return directory.resolve(baseFileName + "_" + generation + fileExtension);
    }

    /** 현재 파일 (항상 포함) 뒤에 존재하는 아카이브를 최신순으로 */
    public List<Path> existingGenerations() {
        List<Path> files = new ArrayList<>();
        files.add(currentFile());
        for (int i = 1; i <= maxArchiveFiles; i++) {
            Path archive = generationFile(i);
            if (Files.exists(archive)) {
                files.add(archive);
            }
        }
        return files;
    }

    /** 디렉토리와 현재 파일 생성. 실패 시 false. */
    public boolean ensureCurrentFile() {
        try {
            Files.createDirectories(directory);
            Path current = currentFile();
            if (!Files.exists(current)) {
                Files.createFile(current);
            }
            return true;
        } catch (IOException e) {
            log.warn("Failed to prepare log file {}: {}", currentFile(), e.getMessage());
            metrics.recordIoFailure();
            return false;
        }
    }

    /** 존재하는 모든 세대 크기 합. 읽을 수 없는 파일은 0으로 계산. */
    public long totalSizeBytes() {
        long total = 0;
        for (Path file : existingGenerations()) {
            total += sizeOf(file);
        }
        return total;
    }

    /** 존재하는 모든 세대를 0 바이트로. 파일 자체는 남긴다. */
    public void truncateAll() {
        for (Path file : existingGenerations()) {
            if (!Files.exists(file)) {
                continue;
            }
            try {
                Files.write(file, new byte[0]);
            } catch (IOException e) {
                log.warn("Failed to truncate log file {}: {}", file, e.getMessage());
                metrics.recordIoFailure();
            }
        }
    }

    /**
     * 현재 파일이 최대 크기를 넘으면 세대를 한 칸씩 민다.
     *
     * @return 로테이션 수행 여부
     */
    public boolean rotateIfNeeded() {
        Path current = currentFile();
        if (sizeOf(current) <= maxFileSizeBytes) {
            return false;
        }

        for (int i = maxArchiveFiles - 1; i >= 1; i--) {
            Path source = generationFile(i);
            if (!Files.exists(source)) {
                continue;
            }
            Path target = generationFile(i + 1);
            try {
                Files.deleteIfExists(target);
                Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                log.warn("Failed to shift log archive {} -> {}: {}", source, target, e.getMessage());
                metrics.recordIoFailure();
            }
        }

        Path firstArchive = generationFile(1);
        try {
            Files.deleteIfExists(firstArchive);
            Files.move(current, firstArchive, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            log.warn("Failed to archive log file {}: {}", current, e.getMessage());
            metrics.recordIoFailure();
            return false;
        }

        ensureCurrentFile();
        metrics.recordRotation();
        log.debug("Rotated log file {} (limit {} bytes)", current, maxFileSizeBytes);
        return true;
    }

    private long sizeOf(Path file) {
        try {
            return Files.exists(file) ? Files.size(file) : 0L;
        } catch (IOException e) {
            log.warn("Failed to read size of {}: {}", file, e.getMessage());
            return 0L;
        }
    }
}
