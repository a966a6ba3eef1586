package io.structor.core.model;

import java.util.Objects;

/**
 * Outcome of running one conversion step against a field value.
 *
 * <p>
 * Either {@link #ok(Object)} carrying the converted value (which may be
 * {@code null}), or a failure carrying a message or a nested
 * {@link ErrorReport}. Conversion functions return failures as values; they
 * do not throw.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class StepResult {

    private final boolean ok;
    private final Object value;
    private final Object errorDetail;

    private StepResult(boolean ok, Object value, Object errorDetail) {
        this.ok = ok;
        this.value = value;
        this.errorDetail = errorDetail;
    }

    public static StepResult ok(Object value) {
        return new StepResult(true, value, null);
    }

    public static StepResult error(String message) {
        Objects.requireNonNull(message, "message must not be null");
        return new StepResult(false, null, message);
    }

    /** A failure carrying a nested report, e.g. from a nested-record constructor. */
    public static StepResult error(ErrorReport report) {
        Objects.requireNonNull(report, "report must not be null");
        return new StepResult(false, null, report);
    }

    public boolean isOk() {
        return ok;
    }

    public boolean isError() {
        return !ok;
    }

    /** The converted value. Only meaningful when {@link #isOk()}. */
    public Object value() {
        return value;
    }

    /** The failure detail: a {@link String} or an {@link ErrorReport}; {@code null} on success. */
    public Object errorDetail() {
        return errorDetail;
    }

    /** The failure message, or {@code null} on success or when the detail is a nested report. */
    public String errorMessage() {
        return errorDetail instanceof String s ? s : null;
    }

    /** The nested report, or {@code null} on success or when the detail is a message. */
    public ErrorReport errorReport() {
        return errorDetail instanceof ErrorReport r ? r : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StepResult that)) return false;
        return ok == that.ok && Objects.equals(value, that.value) && Objects.equals(errorDetail, that.errorDetail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ok, value, errorDetail);
    }

    @Override
    public String toString() {
        return ok ? "StepResult[ok=" + value + "]" : "StepResult[error=" + errorDetail + "]";
    }
}
