package io.structor.core.model;

import java.util.Objects;

/**
 * Hard failure: the input is not a shape a record can be built from.
 *
 * @param inputType the simple class name of the rejected input
 * @param detail    human-readable description
 */
public record ShapeError(String inputType, String detail) {

    public ShapeError {
        Objects.requireNonNull(inputType, "inputType must not be null");
        Objects.requireNonNull(detail, "detail must not be null");
    }

    /** Describes an unrecognized input value. */
    public static ShapeError unrecognized(String schemaName, Object input) {
        String type = input.getClass().getSimpleName();
        return new ShapeError(type, "cannot build '" + schemaName + "' from input of type " + type);
    }
}
