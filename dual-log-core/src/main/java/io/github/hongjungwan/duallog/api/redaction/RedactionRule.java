package io.github.hongjungwan.duallog.api.redaction;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 자동 스캔 규칙 (패턴 → 치환 문자열). 치환 문자열은 {@code $1} 그룹 참조를 지원한다.
 */
public record RedactionRule(String name, Pattern pattern, String replacement) {

    public RedactionRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(replacement, "replacement");
    }

    public static RedactionRule of(String name, String regex, String replacement) {
        return new RedactionRule(name, Pattern.compile(regex), replacement);
    }

    public static RedactionRule caseInsensitive(String name, String regex, String replacement) {
        return new RedactionRule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement);
    }

    public String apply(String text) {
        return pattern.matcher(text).replaceAll(replacement);
    }
}
