package io.structor.core.model;

import java.util.Objects;

/**
 * Outcome of a lifecycle hook: either proceed with a (possibly reshaped)
 * value, or reject the whole construction with an {@link ErrorReport}.
 *
 * @param <T> the value the hook hands on
 */
public final class HookResult<T> {

    private final T value;
    private final ErrorReport rejection;

    private HookResult(T value, ErrorReport rejection) {
        this.value = value;
        this.rejection = rejection;
    }

    public static <T> HookResult<T> proceed(T value) {
        return new HookResult<>(value, null);
    }

    public static <T> HookResult<T> reject(ErrorReport report) {
        Objects.requireNonNull(report, "report must not be null");
        return new HookResult<>(null, report);
    }

    /** Rejects with a single-entry report. */
    public static <T> HookResult<T> reject(String field, String message) {
        return reject(ErrorReport.of(field, message));
    }

    public boolean isRejected() {
        return rejection != null;
    }

    public T value() {
        return value;
    }

    public ErrorReport rejection() {
        return rejection;
    }

    @Override
    public String toString() {
        return isRejected() ? "HookResult[reject=" + rejection + "]" : "HookResult[proceed=" + value + "]";
    }
}
