package io.github.hongjungwan.duallog.api.domain;

import org.slf4j.event.Level;

import java.util.Locale;
import java.util.Optional;

/**
 * 로그 레벨. 숫자 rank 기준 전순서, 레벨별 고정 glyph 와 콘솔 싱크 severity 매핑.
 */
public enum LogLevel {
    DEBUG(0, "🐛", Level.DEBUG),
    INFO(1, "💙", Level.INFO),
    WARNING(2, "⚠️", Level.WARN),
    ERROR(3, "❤️", Level.ERROR),
    CRITICAL(4, "💀", Level.ERROR);

    private static final LogLevel[] BY_RANK = values();

    private final int rank;
    private final String glyph;
    private final Level consoleLevel;

    LogLevel(int rank, String glyph, Level consoleLevel) {
        this.rank = rank;
        this.glyph = glyph;
        this.consoleLevel = consoleLevel;
    }

    public int getRank() {
        return rank;
    }

    public String getGlyph() {
        return glyph;
    }

    /** 콘솔 싱크(SLF4J)로 전달할 때 사용하는 severity */
    public Level getConsoleLevel() {
        return consoleLevel;
    }

    public boolean isAtLeast(LogLevel other) {
        return rank >= other.rank;
    }

    /** 스택 트레이스 첨부가 허용되는 레벨 (ERROR, CRITICAL) */
    public boolean allowsStackTrace() {
        return isAtLeast(ERROR);
    }

    public static Optional<LogLevel> fromRank(int rank) {
        if (rank < 0 || rank >= BY_RANK.length) {
            return Optional.empty();
        }
        return Optional.of(BY_RANK[rank]);
    }

    /**
     * 숫자 rank("0".."4") 또는 레벨 이름(대소문자 무시)을 레벨로 변환.
     */
    public static Optional<LogLevel> fromToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }

        String trimmed = token.trim();
        if (trimmed.chars().allMatch(Character::isDigit)) {
            try {
                return fromRank(Integer.parseInt(trimmed));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }

        String upper = trimmed.toUpperCase(Locale.ROOT);
        for (LogLevel level : BY_RANK) {
            if (level.name().equals(upper)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }
}
