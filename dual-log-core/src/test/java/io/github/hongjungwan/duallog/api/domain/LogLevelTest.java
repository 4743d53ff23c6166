package io.github.hongjungwan.duallog.api.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.slf4j.event.Level;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LogLevel 테스트")
class LogLevelTest {

    @Nested
    @DisplayName("순서")
    class OrderingTests {

        @Test
        @DisplayName("rank 는 DEBUG 0 부터 CRITICAL 4 까지 증가해야 한다")
        void shouldOrderByRank() {
            assertThat(LogLevel.values())
                    .extracting(LogLevel::getRank)
                    .containsExactly(0, 1, 2, 3, 4);
        }

        @Test
        @DisplayName("isAtLeast 는 같은 레벨을 포함해야 한다")
        void shouldIncludeSameLevel() {
            assertThat(LogLevel.WARNING.isAtLeast(LogLevel.WARNING)).isTrue();
            assertThat(LogLevel.WARNING.isAtLeast(LogLevel.ERROR)).isFalse();
            assertThat(LogLevel.CRITICAL.isAtLeast(LogLevel.DEBUG)).isTrue();
        }

        @Test
        @DisplayName("스택 트레이스는 ERROR 와 CRITICAL 만 허용해야 한다")
        void shouldAllowStackTraceOnlyForErrorAndAbove() {
            assertThat(LogLevel.INFO.allowsStackTrace()).isFalse();
            assertThat(LogLevel.WARNING.allowsStackTrace()).isFalse();
            assertThat(LogLevel.ERROR.allowsStackTrace()).isTrue();
            assertThat(LogLevel.CRITICAL.allowsStackTrace()).isTrue();
        }
    }

    @Nested
    @DisplayName("표시 정보")
    class DisplayTests {

        @Test
        @DisplayName("레벨마다 고정 glyph 를 가져야 한다")
        void shouldHaveFixedGlyphs() {
            assertThat(LogLevel.values())
                    .extracting(LogLevel::getGlyph)
                    .containsExactly("🐛", "💙", "⚠️", "❤️", "💀");
        }

        @Test
        @DisplayName("CRITICAL 은 콘솔에서 ERROR severity 로 매핑되어야 한다")
        void shouldMapCriticalToError() {
            assertThat(LogLevel.WARNING.getConsoleLevel()).isEqualTo(Level.WARN);
            assertThat(LogLevel.CRITICAL.getConsoleLevel()).isEqualTo(Level.ERROR);
        }
    }

    @Nested
    @DisplayName("토큰 변환")
    class FromTokenTests {

        @ParameterizedTest
        @CsvSource({"0,DEBUG", "1,INFO", "2,WARNING", "3,ERROR", "4,CRITICAL",
                "debug,DEBUG", "Warning,WARNING", "CRITICAL,CRITICAL"})
        @DisplayName("숫자 rank 와 대소문자 무시 이름을 모두 해석해야 한다")
        void shouldResolveRankAndName(String token, LogLevel expected) {
            assertThat(LogLevel.fromToken(token)).contains(expected);
        }

        @Test
        @DisplayName("알 수 없는 토큰은 empty 를 반환해야 한다")
        void shouldReturnEmptyForUnknownToken() {
            assertThat(LogLevel.fromToken("5")).isEmpty();
            assertThat(LogLevel.fromToken("TRACE")).isEmpty();
            assertThat(LogLevel.fromToken("")).isEmpty();
            assertThat(LogLevel.fromToken(null)).isEmpty();
            assertThat(LogLevel.fromToken("99999999999999")).isEmpty();
        }
    }
}
