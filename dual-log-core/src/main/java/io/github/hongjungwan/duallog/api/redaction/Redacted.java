package io.github.hongjungwan.duallog.api.redaction;

import java.util.Objects;

/**
 * 명시적 마킹 값. 콘솔 채널에는 실제 값, 파일 채널에는 placeholder 로 출력된다.
 *
 * <p>{@link #toString()} 은 placeholder 를 반환한다. 문자열 연결로 메시지에
 * 섞여 들어가도 실제 값은 노출되지 않는다.</p>
 */
public final class Redacted<T> {

    public static final String DEFAULT_PLACEHOLDER = "[REDACTED]";

    private final T value;
    private final String placeholder;

    private Redacted(T value, String placeholder) {
        this.value = value;
        this.placeholder = Objects.requireNonNull(placeholder, "placeholder");
    }

    public static <T> Redacted<T> of(T value) {
        return new Redacted<>(value, DEFAULT_PLACEHOLDER);
    }

    public static <T> Redacted<T> of(T value, String placeholder) {
        return new Redacted<>(value, placeholder);
    }

    /** {@code redact(value, "[HIDDEN]")} 형태의 static import 용 */
    public static <T> Redacted<T> redact(T value, String placeholder) {
        return of(value, placeholder);
    }

    public static <T> Redacted<T> email(T email) {
        return new Redacted<>(email, "[REDACTED_EMAIL]");
    }

    public static <T> Redacted<T> password(T password) {
        return new Redacted<>(password, "[REDACTED_PASSWORD]");
    }

    public static <T> Redacted<T> creditCard(T card) {
        return new Redacted<>(card, "[REDACTED_CARD]");
    }

    public static <T> Redacted<T> apiKey(T key) {
        return new Redacted<>(key, "[REDACTED_API_KEY]");
    }

    public static <T> Redacted<T> phone(T phone) {
        return new Redacted<>(phone, "[REDACTED_PHONE]");
    }

    public T getValue() {
        return value;
    }

    public String getPlaceholder() {
        return placeholder;
    }

    /** 콘솔 채널용 실제 값 문자열 */
    public String reveal() {
        return RedactableMessage.render(value);
    }

    @Override
    public String toString() {
        return placeholder;
    }
}
