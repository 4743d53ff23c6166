package io.github.hongjungwan.duallog.spi;

import io.github.hongjungwan.duallog.api.redaction.RedactionRule;

import java.util.List;

/**
 * 추가 자동 스캔 규칙 SPI. 기본 규칙 뒤에 등록 순서대로 적용된다.
 *
 * <p>ServiceLoader 로 등록:</p>
 * <pre>
 * META-INF/services/io.github.hongjungwan.duallog.spi.RedactionRuleProvider
 * </pre>
 *
 * @since 1.0.0
 */
public interface RedactionRuleProvider {

    List<RedactionRule> rules();
}
