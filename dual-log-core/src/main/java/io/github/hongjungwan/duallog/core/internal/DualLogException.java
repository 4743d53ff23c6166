package io.github.hongjungwan.duallog.core.internal;

/**
 * 파이프라인 수명주기 오용 예외 (예: 닫힌 파이프라인 재시작).
 */
public class DualLogException extends RuntimeException {

    public DualLogException(String message) {
        super(message);
    }

    public DualLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
