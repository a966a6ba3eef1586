package io.structor.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one construction call. Exactly one of four states:
 *
 * <ul>
 * <li>{@link Type#SUCCESS}: {@code value} holds a {@link Struct}, a
 * {@code List} of results for list input, or {@code null} for a null input
 * when {@code nilToEmpty} is off.
 * <li>{@link Type#INVALID}: one or more fields (or list elements) failed;
 * {@code errorReport} holds every failure.
 * <li>{@link Type#SHAPE_ERROR}: the input shape was not recognized.
 * <li>{@link Type#KEY_ERROR}: key checking rejected the input before any
 * field ran.
 * </ul>
 */
public final class ConstructionResult {

    /** The type of construction outcome. */
    public enum Type {
        SUCCESS,
        INVALID,
        SHAPE_ERROR,
        KEY_ERROR
    }

    private final Type type;
    private final Object value;
    private final ErrorReport errorReport;
    private final ShapeError shapeError;
    private final KeyError keyError;

    private ConstructionResult(
            Type type, Object value, ErrorReport errorReport, ShapeError shapeError, KeyError keyError) {
        this.type = type;
        this.value = value;
        this.errorReport = errorReport;
        this.shapeError = shapeError;
        this.keyError = keyError;
    }

    /** Creates a SUCCESS result. {@code value} may be {@code null}. */
    public static ConstructionResult success(Object value) {
        return new ConstructionResult(Type.SUCCESS, value, null, null, null);
    }

    public static ConstructionResult invalid(ErrorReport report) {
        Objects.requireNonNull(report, "report must not be null for INVALID");
        return new ConstructionResult(Type.INVALID, null, report, null, null);
    }

    public static ConstructionResult shapeError(ShapeError error) {
        Objects.requireNonNull(error, "error must not be null for SHAPE_ERROR");
        return new ConstructionResult(Type.SHAPE_ERROR, null, null, error, null);
    }

    public static ConstructionResult keyError(KeyError error) {
        Objects.requireNonNull(error, "error must not be null for KEY_ERROR");
        return new ConstructionResult(Type.KEY_ERROR, null, null, null, error);
    }

    public Type type() {
        return type;
    }

    /** The built value. Only valid when {@code type() == SUCCESS}. */
    public Object value() {
        return value;
    }

    /**
     * The built record.
     *
     * @throws IllegalStateException if the result is not a SUCCESS holding a
     *                               {@link Struct}
     */
    public Struct struct() {
        if (type != Type.SUCCESS || !(value instanceof Struct s)) {
            throw new IllegalStateException("Not a single-record success: " + this);
        }
        return s;
    }

    /**
     * The built records for list input.
     *
     * @throws IllegalStateException if the result is not a SUCCESS holding a list
     */
    public List<Object> list() {
        if (type != Type.SUCCESS || !(value instanceof List<?> elements)) {
            throw new IllegalStateException("Not a list success: " + this);
        }
        return Collections.unmodifiableList(elements);
    }

    /** Only valid when {@code type() == INVALID}. */
    public ErrorReport errorReport() {
        return errorReport;
    }

    /** Only valid when {@code type() == SHAPE_ERROR}. */
    public ShapeError shapeError() {
        return shapeError;
    }

    /** Only valid when {@code type() == KEY_ERROR}. */
    public KeyError keyError() {
        return keyError;
    }

    public boolean isSuccess() {
        return type == Type.SUCCESS;
    }

    public boolean isFailure() {
        return type != Type.SUCCESS;
    }

    /** A one-line description of the failure, or {@code null} on success. */
    public String failureDetail() {
        return switch (type) {
            case SUCCESS -> null;
            case INVALID -> "invalid: " + errorReport;
            case SHAPE_ERROR -> shapeError.detail();
            case KEY_ERROR -> keyError.detail();
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConstructionResult that)) return false;
        return type == that.type
                && Objects.equals(value, that.value)
                && Objects.equals(errorReport, that.errorReport)
                && Objects.equals(shapeError, that.shapeError)
                && Objects.equals(keyError, that.keyError);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, errorReport, shapeError, keyError);
    }

    @Override
    public String toString() {
        return switch (type) {
            case SUCCESS -> "ConstructionResult[SUCCESS, " + value + "]";
            case INVALID -> "ConstructionResult[INVALID, " + errorReport + "]";
            case SHAPE_ERROR -> "ConstructionResult[SHAPE_ERROR, " + shapeError.detail() + "]";
            case KEY_ERROR -> "ConstructionResult[KEY_ERROR, " + keyError.detail() + "]";
        };
    }
}
