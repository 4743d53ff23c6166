package io.github.hongjungwan.duallog.core.internal;

import java.time.Instant;
import java.util.concurrent.atomic.LongAdder;

/**
 * 파이프라인 메트릭 수집 (LongAdder 기반 lock-free). 파이프라인 인스턴스마다 하나.
 */
public final class PipelineMetrics {

    private final Instant startTime = Instant.now();

    private final LongAdder logged = new LongAdder();
    private final LongAdder filtered = new LongAdder();
    private final LongAdder dropped = new LongAdder();
    private final LongAdder consoleDropped = new LongAdder();
    private final LongAdder consoleFailures = new LongAdder();
    private final LongAdder flushes = new LongAdder();
    private final LongAdder bytesWritten = new LongAdder();
    private final LongAdder rotations = new LongAdder();
    private final LongAdder ioFailures = new LongAdder();
    private final LongAdder parseFailures = new LongAdder();

    public void recordLogged() {
        logged.increment();
    }

    public void recordFiltered() {
        filtered.increment();
    }

    /** writer 큐 포화로 버려진 라인. 누적 건수 반환. */
    public long recordDropped() {
        dropped.increment();
        return dropped.sum();
    }

    public void recordConsoleDropped() {
        consoleDropped.increment();
    }

    public void recordConsoleFailure() {
        consoleFailures.increment();
    }

    public void recordFlush(long bytes) {
        flushes.increment();
        bytesWritten.add(bytes);
    }

    public void recordRotation() {
        rotations.increment();
    }

    public void recordIoFailure() {
        ioFailures.increment();
    }

    public void recordParseFailures(long count) {
        parseFailures.add(count);
    }

    public Snapshot getSnapshot() {
        return new Snapshot(
                Instant.now(),
                startTime,
                logged.sum(),
                filtered.sum(),
                dropped.sum(),
                consoleDropped.sum(),
                consoleFailures.sum(),
                flushes.sum(),
                bytesWritten.sum(),
                rotations.sum(),
                ioFailures.sum(),
                parseFailures.sum()
        );
    }

    /** 메트릭 스냅샷 */
    public record Snapshot(
            Instant timestamp,
            Instant startTime,
            long logged,
            long filtered,
            long dropped,
            long consoleDropped,
            long consoleFailures,
            long flushes,
            long bytesWritten,
            long rotations,
            long ioFailures,
            long parseFailures
    ) {
        @Override
        public String toString() {
            return String.format(
                    "PipelineMetrics[logged=%d, filtered=%d, dropped=%d, consoleDropped=%d, consoleFailures=%d, "
                            + "flushes=%d, bytesWritten=%d, rotations=%d, ioFailures=%d, parseFailures=%d]",
                    logged, filtered, dropped, consoleDropped, consoleFailures,
                    flushes, bytesWritten, rotations, ioFailures, parseFailures);
        }
    }
}
