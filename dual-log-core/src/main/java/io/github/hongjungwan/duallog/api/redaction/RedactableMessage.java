package io.github.hongjungwan.duallog.api.redaction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 리터럴 텍스트와 {@link Redacted} 값으로 구성된 로그 메시지.
 *
 * <p>마킹 값은 문자열에 인코딩되지 않고 세그먼트로 따로 보관된다. 실제 값에 어떤
 * 문자가 들어 있어도 채널별 해석이 깨지지 않는다.</p>
 *
 * <pre>{@code
 * logger.info(RedactableMessage.format("Login {} from {}", Redacted.email(email), ip));
 * }</pre>
 */
public final class RedactableMessage {

    private static final String ANCHOR = "{}";

    private final List<Segment> segments;

    private RedactableMessage(List<Segment> segments) {
        this.segments = Collections.unmodifiableList(segments);
    }

    /** 마킹 없는 평문 메시지 */
    public static RedactableMessage of(String text) {
        List<Segment> segments = new ArrayList<>(1);
        segments.add(Segment.literal(text == null ? "null" : text));
        return new RedactableMessage(segments);
    }

    /**
     * SLF4J 스타일 {@code {}} 앵커에 인자를 채운다. {@link Redacted} 인자는 마킹 세그먼트,
     * 나머지는 리터럴이 된다. 인자가 모자라면 앵커는 그대로 남고 남는 인자는 무시된다.
     */
    public static RedactableMessage format(String pattern, Object... args) {
        Builder builder = builder();
        if (pattern == null) {
            return builder.text("null").build();
        }

        int argIndex = 0;
        int cursor = 0;
        int anchor;
        while (args != null && argIndex < args.length && (anchor = pattern.indexOf(ANCHOR, cursor)) >= 0) {
            builder.text(pattern.substring(cursor, anchor));
            builder.value(args[argIndex++]);
            cursor = anchor + ANCHOR.length();
        }
        builder.text(pattern.substring(cursor));
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Segment> getSegments() {
        return segments;
    }

    public boolean hasRedactedValues() {
        return segments.stream().anyMatch(Segment::isRedacted);
    }

    /** placeholder 가 적용된 텍스트 (자동 스캔 없음) */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Segment segment : segments) {
            sb.append(segment.isRedacted() ? segment.redacted().getPlaceholder() : segment.text());
        }
        return sb.toString();
    }

    /** 인자 렌더링. toString() 실패 시에도 예외를 던지지 않는다. */
    static String render(Object value) {
        if (value == null) {
            return "null";
        }
        try {
            return String.valueOf(value);
        } catch (RuntimeException e) {
            return "[unrenderable " + value.getClass().getSimpleName() + "]";
        }
    }

    /** 메시지 조각. {@code redacted} 가 null 이면 리터럴. */
    public record Segment(String text, Redacted<?> redacted) {

        static Segment literal(String text) {
            return new Segment(text, null);
        }

        static Segment marked(Redacted<?> redacted) {
            return new Segment(null, redacted);
        }

        public boolean isRedacted() {
            return redacted != null;
        }
    }

    public static final class Builder {
        private final List<Segment> segments = new ArrayList<>();

        private Builder() {
        }

        public Builder text(String text) {
            if (text != null && !text.isEmpty()) {
                segments.add(Segment.literal(text));
            }
            return this;
        }

        public Builder redacted(Redacted<?> redacted) {
            if (redacted != null) {
                segments.add(Segment.marked(redacted));
            }
            return this;
        }

        /** Redacted 면 마킹 세그먼트, 아니면 렌더링한 리터럴 */
        public Builder value(Object value) {
            if (value instanceof Redacted<?> redacted) {
                return redacted(redacted);
            }
            segments.add(Segment.literal(render(value)));
            return this;
        }

        public RedactableMessage build() {
            return new RedactableMessage(new ArrayList<>(segments));
        }
    }
}
