package io.structor.core.error;

import io.structor.core.model.ShapeError;

/** Thrown by {@code constructOrThrow} when the input shape is not recognized. */
public final class ShapeException extends ConstructionFailureException {

    private static final long serialVersionUID = 1L;

    private final transient ShapeError shapeError;

    public ShapeException(String schemaName, ShapeError shapeError) {
        super(shapeError.detail(), schemaName);
        this.shapeError = shapeError;
    }

    public ShapeError shapeError() {
        return shapeError;
    }
}
