package io.github.hongjungwan.duallog.core.redaction;

import io.github.hongjungwan.duallog.api.config.DualLogConfig;
import io.github.hongjungwan.duallog.api.redaction.OutputChannel;
import io.github.hongjungwan.duallog.api.redaction.RedactableMessage;
import io.github.hongjungwan.duallog.api.redaction.RedactionRule;
import io.github.hongjungwan.duallog.spi.RedactionRuleProvider;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * 민감정보 처리기. 패턴 기반 자동 스캔과 명시적 마킹의 채널별 해석을 담당한다.
 *
 * <p>규칙은 고정 순서로 적용되며 뒤 규칙은 앞 규칙이 치환한 텍스트를 입력으로 받는다.
 * 카드번호가 SSN/전화번호보다 먼저 치환되어야 하므로 순서를 바꾸면 안 된다.</p>
 */
@Slf4j
public class RedactionEngine {

    /** 기본 규칙 (적용 순서) */
    public static final List<RedactionRule> DEFAULT_RULES = List.of(
            RedactionRule.of("credit_card",
                    "\\b\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}\\b", "[REDACTED_CARD]"),
            RedactionRule.of("email",
                    "\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b", "[REDACTED_EMAIL]"),
            RedactionRule.of("phone",
                    "\\b\\d{3}[-.\\s]?\\d{3}[-.\\s]?\\d{4}\\b", "[REDACTED_PHONE]"),
            RedactionRule.of("ssn",
                    "\\b\\d{3}[-.\\s]?\\d{2}[-.\\s]?\\d{4}\\b", "[REDACTED_SSN]"),
            RedactionRule.caseInsensitive("password",
                    "password[\\s:=]+\\S+", "password: [REDACTED_PASSWORD]"),
            RedactionRule.caseInsensitive("api_key",
                    "(api[_\\-\\s]?key|token)[\\s:=]+\\S+", "$1: [REDACTED_API_KEY]"),
            RedactionRule.of("ip_address",
                    "\\b(?:\\d{1,3}\\.){3}\\d{1,3}\\b", "[REDACTED_IP]")
    );

    private final List<RedactionRule> rules;
    private final boolean scanningEnabled;

    public RedactionEngine(DualLogConfig config) {
        this(collectRules(config.getAdditionalRedactionRules()), config.isRedactionEnabled());
    }

    public RedactionEngine(List<RedactionRule> rules, boolean scanningEnabled) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
        this.scanningEnabled = scanningEnabled;
    }

    private static List<RedactionRule> collectRules(List<RedactionRule> configured) {
        List<RedactionRule> all = new ArrayList<>(DEFAULT_RULES);
        all.addAll(configured);

        try {
            for (RedactionRuleProvider provider : ServiceLoader.load(RedactionRuleProvider.class)) {
                List<RedactionRule> provided = provider.rules();
                if (provided != null) {
                    all.addAll(provided);
                    log.debug("Loaded {} redaction rules from {}", provided.size(), provider.getClass().getName());
                }
            }
        } catch (ServiceConfigurationError e) {
            log.warn("Failed to load RedactionRuleProvider: {}", e.getMessage());
        }

        return all;
    }

    /**
     * 채널별 메시지 해석. CONSOLE 은 실제 값, PERSISTED 는 placeholder 와 리터럴 자동 스캔.
     * 인접한 리터럴 세그먼트는 이어 붙인 뒤 한 번에 스캔하고, placeholder 는 경계로 남아 다시 스캔하지 않는다.
     */
    public String resolve(RedactableMessage message, OutputChannel channel) {
        StringBuilder sb = new StringBuilder();
        StringBuilder literals = new StringBuilder();
        for (RedactableMessage.Segment segment : message.getSegments()) {
            if (!segment.isRedacted()) {
                literals.append(segment.text());
                continue;
            }
            appendLiterals(sb, literals, channel);
            sb.append(channel == OutputChannel.CONSOLE
                    ? segment.redacted().reveal()
                    : segment.redacted().getPlaceholder());
        }
        appendLiterals(sb, literals, channel);
        return sb.toString();
    }

    private void appendLiterals(StringBuilder target, StringBuilder literals, OutputChannel channel) {
        if (literals.length() == 0) {
            return;
        }
        String text = literals.toString();
        target.append(channel == OutputChannel.CONSOLE ? text : scan(text));
        literals.setLength(0);
    }

    /** 문자열 내 민감정보 패턴 자동 치환 */
    public String scan(String text) {
        if (!scanningEnabled || text == null || text.isEmpty()) {
            return text;
        }

        String result = text;
        for (RedactionRule rule : rules) {
            try {
                result = rule.apply(result);
            } catch (RuntimeException e) {
                // 잘못된 치환 문자열 등: 해당 규칙만 건너뜀
                log.warn("Redaction rule '{}' failed: {}", rule.name(), e.getMessage());
            }
        }
        return result;
    }

    public List<RedactionRule> getRules() {
        return rules;
    }
}
